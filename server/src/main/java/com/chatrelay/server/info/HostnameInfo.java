package com.chatrelay.server.info;

import java.net.InetAddress;
import java.net.UnknownHostException;

public class HostnameInfo implements InfoProvider {

    @Override
    public String key() {
        return "Hostname";
    }

    @Override
    public String value() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "Unknown hostname";
        }
    }
}
