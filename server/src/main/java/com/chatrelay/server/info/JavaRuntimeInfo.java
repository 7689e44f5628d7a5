package com.chatrelay.server.info;

public class JavaRuntimeInfo implements InfoProvider {

    @Override
    public String key() {
        return "Java";
    }

    @Override
    public String value() {
        return Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")";
    }
}
