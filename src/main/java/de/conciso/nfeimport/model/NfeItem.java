package de.conciso.nfeimport.model;

/**
 * One product line ({@code det}) of an NF-e.
 */
public record NfeItem(
        String accessKey,
        int itemNumber,
        String productCode,
        String productDescription,
        String cfop,
        String commercialUnit,
        double quantity,
        double unitValue,
        double totalValue,
        double icmsValue,
        double pisValue,
        double cofinsValue) {
}
