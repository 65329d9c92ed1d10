package com.skillbench.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "skillbench.workspace")
public class WorkspaceProperties {

    private String root = System.getProperty("user.home") + "/.skillbench";

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }
}
