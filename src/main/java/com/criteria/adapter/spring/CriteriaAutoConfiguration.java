package com.criteria.adapter.spring;

import com.criteria.config.RuleLoader;
import com.criteria.config.RuleParser;
import com.criteria.descriptor.DescriptorConverter;
import com.criteria.evaluator.CriteriaEvaluator;
import com.criteria.evaluator.DefaultCriteriaEvaluator;
import com.criteria.sql.SqlCompiler;
import com.criteria.variable.DefaultFieldResolver;
import com.criteria.variable.FieldResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for criteria.
 */
@Configuration
@ConditionalOnProperty(prefix = "criteria", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CriteriaProperties.class)
public class CriteriaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CriteriaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FieldResolver fieldResolver() {
        return new DefaultFieldResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public CriteriaEvaluator criteriaEvaluator(FieldResolver fieldResolver) {
        return new DefaultCriteriaEvaluator(fieldResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlCompiler sqlCompiler(CriteriaProperties properties) {
        log.info("Creating SqlCompiler with {} column mapping(s), default columns {}",
                properties.getColumnMapping().size(), properties.getDefaultColumns());
        return new SqlCompiler(properties.getColumnMapping(), properties.getDefaultColumns());
    }

    @Bean
    @ConditionalOnMissingBean
    public DescriptorConverter descriptorConverter(CriteriaProperties properties) {
        return new DescriptorConverter(properties.getColumnMapping());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleParser ruleParser() {
        return new RuleParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleLoader ruleLoader(RuleParser ruleParser) {
        return new RuleLoader(ruleParser);
    }
}
