package com.bogotasae.reggis.core.reference;

public record ReferenceCounts(long materials, long clients) {
}
