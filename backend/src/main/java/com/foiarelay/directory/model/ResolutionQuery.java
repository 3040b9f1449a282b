package com.foiarelay.directory.model;

public record ResolutionQuery(String unitId, String name) {

    public static ResolutionQuery byUnitId(String unitId) {
        return new ResolutionQuery(unitId, null);
    }

    public static ResolutionQuery byName(String name) {
        return new ResolutionQuery(null, name);
    }

    public boolean hasUnitId() {
        return unitId != null && !unitId.isBlank();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
