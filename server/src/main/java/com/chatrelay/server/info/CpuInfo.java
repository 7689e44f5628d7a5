package com.chatrelay.server.info;

import java.lang.management.ManagementFactory;

public class CpuInfo implements InfoProvider {

    @Override
    public String key() {
        return "CPU";
    }

    @Override
    public String value() {
        String arch = ManagementFactory.getOperatingSystemMXBean().getArch();
        int cores = Runtime.getRuntime().availableProcessors();
        return arch + " (" + cores + " cores)";
    }
}
