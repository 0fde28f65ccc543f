package com.example.fileingest.review;

import java.nio.file.Path;

public record ConfirmResult(String id, String category, Path destination) {
}
