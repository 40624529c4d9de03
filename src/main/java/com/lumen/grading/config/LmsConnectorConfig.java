package com.lumen.grading.config;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.lumen.grading.adapter.LmsConnector;
import com.lumen.grading.model.enums.LmsType;

/**
 * Configuration for LMS connectors.
 *
 * Registers all available LmsConnector implementations and provides
 * them as a Map indexed by LmsType for lookup by the sync dispatcher.
 */
@Configuration
public class LmsConnectorConfig {

    /**
     * Create a map of LMS connectors indexed by LMS type.
     *
     * @param connectors all available LmsConnector beans
     * @return map of LmsType -> LmsConnector
     */
    @Bean
    public Map<LmsType, LmsConnector> lmsConnectors(List<LmsConnector> connectors) {
        Map<LmsType, LmsConnector> connectorMap = new EnumMap<>(LmsType.class);

        for (LmsConnector connector : connectors) {
            connectorMap.put(connector.getLmsType(), connector);
        }

        return connectorMap;
    }
}
