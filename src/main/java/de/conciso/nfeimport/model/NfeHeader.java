package de.conciso.nfeimport.model;

import java.time.LocalDate;

/**
 * Summary record of one NF-e, keyed by its 44-digit access key.
 *
 * <p>Dates are {@code null} when the document carries none or carries one that is not
 * in {@code yyyy-MM-dd} form. Monetary values default to 0.
 */
public record NfeHeader(
        String accessKey,
        String invoiceNumber,
        String series,
        LocalDate issueDate,
        LocalDate movementDate,
        String operationNature,
        String issuerTaxId,
        String issuerName,
        String recipientTaxId,
        String recipientName,
        double totalValue,
        double icmsValue,
        double pisValue,
        double cofinsValue) {
}
