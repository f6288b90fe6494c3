package de.conciso.nfeimport.model;

import java.util.List;

public record NfeDocument(NfeHeader header, List<NfeItem> items) {

    public NfeDocument {
        items = List.copyOf(items);
    }

    public String accessKey() {
        return header.accessKey();
    }
}
