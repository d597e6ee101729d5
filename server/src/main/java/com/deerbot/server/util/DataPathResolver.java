package com.deerbot.server.util;

import com.deerbot.server.service.GenerationSettings;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "deerbot.data.dir";

    public static String resolveDataDirectory(GenerationSettings settings) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        if (settings != null && settings.data_directory != null && !settings.data_directory.isEmpty()) {
            return settings.data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(GenerationSettings settings) {
        return resolveDataDirectory(settings) + File.separator + "deerbot.db";
    }
}
