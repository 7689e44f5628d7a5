package com.chatrelay.server.info;

public class OsInfo implements InfoProvider {

    @Override
    public String key() {
        return "OS";
    }

    @Override
    public String value() {
        return System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "")
                + " (" + System.getProperty("os.arch", "unknown") + ")";
    }
}
