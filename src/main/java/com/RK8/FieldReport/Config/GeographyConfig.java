package com.RK8.FieldReport.Config;

import com.RK8.FieldReport.DTO.AliasRule;
import com.RK8.FieldReport.Parser.AliasTableLoader;
import com.RK8.FieldReport.Service.GeographyNormalizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Loads the district alias table once at startup. The resulting normalizer is
 * shared read-only by every report run.
 */
@Configuration
public class GeographyConfig {

    @Bean
    public GeographyNormalizer geographyNormalizer(AliasTableLoader loader, ReportProperties properties) {
        List<AliasRule> rules = loader.load(properties.getGeography().getAliasTable());
        return new GeographyNormalizer(rules, properties.getReconciliation().getUnresolvedMarker());
    }
}
