package com.criteria.spring;

import com.criteria.adapter.spring.CriteriaAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the criteria beans in a Spring application that does not use auto-configuration.
 * 
 * Usage:
 * <pre>
 * &#64;Configuration
 * &#64;EnableCriteria
 * public class PersistenceConfig {
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(CriteriaAutoConfiguration.class)
public @interface EnableCriteria {
}
