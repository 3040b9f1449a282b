package com.foiarelay.directory.api;

public record ResolveRequest(
    String unitId,
    String name
) {}
