package org.dxworks.logframe;

public enum InputFormat {
    LOG("log"),
    EXCEL("excel"),
    TAB("tab");

    private final String name;

    InputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
