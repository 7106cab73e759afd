package com.myorg.normparser.config;

import com.myorg.normparser.service.JsonDocumentWriter;
import com.myorg.normparser.service.NormativeTermsExtractor;
import com.myorg.normparser.service.implementation.JacksonJsonDocumentWriter;
import com.myorg.normparser.service.implementation.PoiNormativeTermsExtractor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({WorkbookLayout.class, StorageProperties.class})
public class ParserConfig {

    @Bean
    public NormativeTermsExtractor normativeTermsExtractor(WorkbookLayout layout) {
        return new PoiNormativeTermsExtractor(layout);
    }

    @Bean
    public JsonDocumentWriter jsonDocumentWriter() {
        return new JacksonJsonDocumentWriter();
    }
}
