package de.conciso.nfeimport.extraction;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import de.conciso.nfeimport.model.NfeDocument;
import de.conciso.nfeimport.model.NfeHeader;
import de.conciso.nfeimport.model.NfeItem;
import org.springframework.stereotype.Component;

/**
 * Maps the generic tree produced by {@link de.conciso.nfeimport.parser.DocumentParser} onto
 * {@link NfeHeader} and {@link NfeItem} records.
 *
 * <p>Lookups are total: absent blocks read as empty, absent text as {@code ""}, absent amounts as 0
 * and absent or malformed dates as {@code null}. Only a tree whose shape contradicts the NF-e layout
 * (text where a block belongs, letters in an amount) is rejected.
 */
@Component
public class NfeExtractor {

    private static final String ACCESS_KEY_PREFIX = "NFe";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public NfeDocument extract(JsonNode tree) {
        JsonNode infNfe = block(block(tree, "NFe"), "infNFe");
        JsonNode ide = block(infNfe, "ide");
        JsonNode emit = block(infNfe, "emit");
        JsonNode dest = block(infNfe, "dest");
        JsonNode icmsTot = block(block(infNfe, "total"), "ICMSTot");

        String accessKey = text(infNfe, "@Id").replace(ACCESS_KEY_PREFIX, "");

        NfeHeader header = new NfeHeader(
                accessKey,
                text(ide, "nNF"),
                text(ide, "serie"),
                date(ide, "dEmi"),
                date(ide, "dSaiEnt"),
                text(ide, "natOp"),
                text(emit, "CNPJ"),
                text(emit, "xNome"),
                text(dest, "CNPJ"),
                text(dest, "xNome"),
                decimal(icmsTot, "vNF"),
                decimal(icmsTot, "vICMS"),
                decimal(icmsTot, "vPIS"),
                decimal(icmsTot, "vCOFINS"));

        List<NfeItem> items = new ArrayList<>();
        for (JsonNode det : lineItems(infNfe)) {
            items.add(extractItem(accessKey, det));
        }
        return new NfeDocument(header, items);
    }

    private NfeItem extractItem(String accessKey, JsonNode det) {
        JsonNode prod = block(det, "prod");
        JsonNode imposto = block(det, "imposto");

        return new NfeItem(
                accessKey,
                integer(det, "@nItem"),
                text(prod, "cProd"),
                text(prod, "xProd"),
                text(prod, "CFOP"),
                text(prod, "uCom"),
                decimal(prod, "qCom"),
                decimal(prod, "vUnCom"),
                decimal(prod, "vProd"),
                decimal(taxVariant(imposto, "ICMS"), "vICMS"),
                decimal(taxVariant(imposto, "PIS"), "vPIS"),
                decimal(taxVariant(imposto, "COFINS"), "vCOFINS"));
    }

    /**
     * A single {@code det} arrives as an object, several as an array.
     */
    private List<JsonNode> lineItems(JsonNode infNfe) {
        JsonNode det = infNfe.path("det");
        if (det.isMissingNode() || det.isNull()) {
            return List.of();
        }
        if (det.isObject()) {
            return List.of(det);
        }
        if (!det.isArray()) {
            throw new ExtractionException("Element 'det' is not a line item block");
        }
        List<JsonNode> result = new ArrayList<>();
        for (JsonNode entry : det) {
            if (!entry.isObject()) {
                throw new ExtractionException("Element 'det' #" + (result.size() + 1) + " is not a line item block");
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * ICMS, PIS and COFINS wrap their fields in one child named after the tax regime
     * ({@code ICMS00}, {@code ICMSSN102}, {@code PISAliq}, ...). The first such child is used whatever
     * its name; a missing tax or a variant without fields yields an empty block, i.e. zeros.
     */
    private JsonNode taxVariant(JsonNode imposto, String taxName) {
        JsonNode tax = imposto.path(taxName);
        if (!tax.isObject()) {
            return MissingNode.getInstance();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = tax.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("@")) {
                continue;
            }
            return field.getValue().isObject() ? field.getValue() : MissingNode.getInstance();
        }
        return MissingNode.getInstance();
    }

    private JsonNode block(JsonNode parent, String name) {
        JsonNode node = parent.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return MissingNode.getInstance();
        }
        if (!node.isObject()) {
            throw new ExtractionException("Element '" + name + "' is not a block (found " + node.getNodeType() + ")");
        }
        return node;
    }

    private String text(JsonNode parent, String name) {
        JsonNode node = parent.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        if (node.isObject() && node.has("#text")) {
            return node.get("#text").asText();
        }
        throw new ExtractionException("Element '" + name + "' does not hold a value (found " + node.getNodeType() + ")");
    }

    private double decimal(JsonNode parent, String name) {
        String value = text(parent, name).trim();
        if (value.isEmpty()) {
            return 0d;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ExtractionException("Element '" + name + "' is not a number: '" + value + "'", e);
        }
    }

    private int integer(JsonNode parent, String name) {
        String value = text(parent, name).trim();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ExtractionException("Attribute '" + name + "' is not an integer: '" + value + "'", e);
        }
    }

    private LocalDate date(JsonNode parent, String name) {
        String value = text(parent, name).trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
