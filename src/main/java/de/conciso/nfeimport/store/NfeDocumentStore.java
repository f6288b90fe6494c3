package de.conciso.nfeimport.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import de.conciso.nfeimport.model.NfeDocument;
import de.conciso.nfeimport.model.NfeHeader;
import de.conciso.nfeimport.model.NfeItem;
import de.conciso.nfeimport.model.SourceFile;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational store for imported NF-e documents.
 *
 * <p>Two SQLite tables are maintained:
 * <ul>
 *   <li>{@code nfe_cabecalho}: one row per access key, replaced on every re-import.</li>
 *   <li>{@code nfe_itens}: the line items of a key, deleted and re-inserted together with the header.</li>
 * </ul>
 *
 * <p>SQLite allows a single writer per database file, so {@link #upsertDocument} is serialized
 * through a lock held for the whole transaction.
 */
@Component
public class NfeDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(NfeDocumentStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * A stored header together with the bookkeeping columns the store fills in.
     */
    public record HeaderRow(NfeHeader header, String fileName, String relativePath, String processedAt) {}

    public NfeDocumentStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS nfe_cabecalho (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    chave_acesso TEXT UNIQUE NOT NULL CHECK (length(chave_acesso) > 0),
                    numero_nf TEXT,
                    serie TEXT,
                    data_emissao DATE,
                    data_saida_entrada DATE,
                    tipo_operacao TEXT,
                    cnpj_emitente TEXT,
                    nome_emitente TEXT,
                    cnpj_destinatario TEXT,
                    nome_destinatario TEXT,
                    valor_total REAL,
                    valor_icms REAL,
                    valor_pis REAL,
                    valor_cofins REAL,
                    arquivo_xml TEXT,
                    caminho_original TEXT,
                    data_processamento DATETIME DEFAULT CURRENT_TIMESTAMP
                )
                """);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS nfe_itens (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    chave_acesso TEXT NOT NULL,
                    numero_item INTEGER,
                    codigo_produto TEXT,
                    descricao_produto TEXT,
                    cfop TEXT,
                    unidade_comercial TEXT,
                    quantidade_comercial REAL,
                    valor_unitario_comercial REAL,
                    valor_total_produto REAL,
                    valor_icms REAL,
                    valor_pis REAL,
                    valor_cofins REAL,
                    FOREIGN KEY (chave_acesso) REFERENCES nfe_cabecalho (chave_acesso)
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_nfe_itens_chave ON nfe_itens (chave_acesso)");
        log.info("Database schema ready");
    }

    public void upsertDocument(NfeDocument document, SourceFile source) {
        upsertDocument(document, source, () -> null);
    }

    /**
     * Replaces header and items of {@code document.accessKey()} in one transaction.
     *
     * <p>{@code beforeCommit} runs after all writes and before the commit; if it throws, the
     * transaction is rolled back and the exception propagates unchanged.
     *
     * @throws DocumentStoreException if any statement or the commit fails
     */
    public <T> T upsertDocument(NfeDocument document, SourceFile source, Supplier<T> beforeCommit) {
        writeLock.lock();
        try {
            T result = transactionTemplate.execute(status -> {
                writeDocument(document, source);
                return beforeCommit.get();
            });
            log.info("NF-e saved: {} - {} item(s)", document.header().invoiceNumber(), document.items().size());
            return result;
        } catch (DataAccessException | TransactionException e) {
            throw new DocumentStoreException(
                    "Failed to save access key '" + document.accessKey() + "': " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void writeDocument(NfeDocument document, SourceFile source) {
        NfeHeader h = document.header();

        // items first: the header row is deleted and re-inserted by REPLACE and must not have children then
        jdbcTemplate.update("DELETE FROM nfe_itens WHERE chave_acesso = ?", h.accessKey());

        jdbcTemplate.update("""
                INSERT OR REPLACE INTO nfe_cabecalho (
                    chave_acesso, numero_nf, serie, data_emissao,
                    data_saida_entrada, tipo_operacao, cnpj_emitente, nome_emitente,
                    cnpj_destinatario, nome_destinatario, valor_total, valor_icms,
                    valor_pis, valor_cofins, arquivo_xml, caminho_original, data_processamento
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """,
                h.accessKey(), h.invoiceNumber(), h.series(), isoDate(h.issueDate()),
                isoDate(h.movementDate()), h.operationNature(), h.issuerTaxId(), h.issuerName(),
                h.recipientTaxId(), h.recipientName(), h.totalValue(), h.icmsValue(),
                h.pisValue(), h.cofinsValue(), source.fileName(), source.relativePath());

        List<Object[]> rows = document.items().stream()
                .map(i -> new Object[] {
                        i.accessKey(), i.itemNumber(), i.productCode(), i.productDescription(),
                        i.cfop(), i.commercialUnit(), i.quantity(), i.unitValue(),
                        i.totalValue(), i.icmsValue(), i.pisValue(), i.cofinsValue()})
                .toList();
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate("""
                    INSERT INTO nfe_itens (
                        chave_acesso, numero_item, codigo_produto, descricao_produto,
                        cfop, unidade_comercial, quantidade_comercial, valor_unitario_comercial,
                        valor_total_produto, valor_icms, valor_pis, valor_cofins
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, rows);
        }
    }

    // ── Queries ─────────────────────────────────────────────────────────

    public Optional<HeaderRow> findHeader(String accessKey) {
        List<HeaderRow> rows = jdbcTemplate.query(
                "SELECT * FROM nfe_cabecalho WHERE chave_acesso = ?",
                (rs, rowNum) -> new HeaderRow(mapHeader(rs),
                        rs.getString("arquivo_xml"),
                        rs.getString("caminho_original"),
                        rs.getString("data_processamento")),
                accessKey);
        return rows.stream().findFirst();
    }

    public List<NfeItem> findItems(String accessKey) {
        return jdbcTemplate.query(
                "SELECT * FROM nfe_itens WHERE chave_acesso = ? ORDER BY numero_item, id",
                (rs, rowNum) -> mapItem(rs),
                accessKey);
    }

    public int countHeaders() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM nfe_cabecalho", Integer.class);
        return count != null ? count : 0;
    }

    public int countItems() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM nfe_itens", Integer.class);
        return count != null ? count : 0;
    }

    private static NfeHeader mapHeader(ResultSet rs) throws SQLException {
        return new NfeHeader(
                rs.getString("chave_acesso"),
                rs.getString("numero_nf"),
                rs.getString("serie"),
                parseIsoDate(rs.getString("data_emissao")),
                parseIsoDate(rs.getString("data_saida_entrada")),
                rs.getString("tipo_operacao"),
                rs.getString("cnpj_emitente"),
                rs.getString("nome_emitente"),
                rs.getString("cnpj_destinatario"),
                rs.getString("nome_destinatario"),
                rs.getDouble("valor_total"),
                rs.getDouble("valor_icms"),
                rs.getDouble("valor_pis"),
                rs.getDouble("valor_cofins"));
    }

    private static NfeItem mapItem(ResultSet rs) throws SQLException {
        return new NfeItem(
                rs.getString("chave_acesso"),
                rs.getInt("numero_item"),
                rs.getString("codigo_produto"),
                rs.getString("descricao_produto"),
                rs.getString("cfop"),
                rs.getString("unidade_comercial"),
                rs.getDouble("quantidade_comercial"),
                rs.getDouble("valor_unitario_comercial"),
                rs.getDouble("valor_total_produto"),
                rs.getDouble("valor_icms"),
                rs.getDouble("valor_pis"),
                rs.getDouble("valor_cofins"));
    }

    // dates are stored as ISO yyyy-MM-dd text
    private static String isoDate(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    private static LocalDate parseIsoDate(String value) {
        return value != null ? LocalDate.parse(value) : null;
    }
}
