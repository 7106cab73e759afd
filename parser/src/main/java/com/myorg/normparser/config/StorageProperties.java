package com.myorg.normparser.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "parser.storage")
public class StorageProperties {

    /** Directory for uploaded workbooks and the produced result.json. */
    private String basePath = "output";

    private String resultFileName = "result.json";
}
