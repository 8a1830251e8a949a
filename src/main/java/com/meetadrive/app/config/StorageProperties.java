package com.meetadrive.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * "meeta.storage.*": where documents are saved and whom they belong to.
 */
@ConfigurationProperties(prefix = "meeta.storage")
public class StorageProperties {

    // Directory holding one <id>.json record per saved document
    private String directory = "data";

    // Owner written into every record; there is a single user for now
    private long userId = 1;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public long getUserId() {
        return userId;
    }

    public void setUserId(long userId) {
        this.userId = userId;
    }
}
