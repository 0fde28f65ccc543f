package com.example.fileingest.index;

import java.util.List;

public record QuarantinePage(List<QuarantinedFile> items, int total, int limit, int offset) {
    public QuarantinePage {
        items = List.copyOf(items);
    }
}
