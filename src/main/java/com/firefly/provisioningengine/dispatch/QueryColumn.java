package com.firefly.provisioningengine.dispatch;

public record QueryColumn(String name, String type) {

    public static QueryColumn of(String name) {
        return new QueryColumn(name, "string");
    }
}
