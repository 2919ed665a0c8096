package com.bikerly.config;

import com.bikerly.util.ConfigHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fails startup when required configuration is missing, before any bean (Mongo client included) is created.
 */
@Component
public class RequiredConfigValidator implements BeanFactoryPostProcessor, EnvironmentAware {

    private static final Logger logger = LoggerFactory.getLogger(RequiredConfigValidator.class);

    // property -> environment variable that feeds it
    static final Map<String, String> REQUIRED_PROPERTIES = new LinkedHashMap<>();
    static {
        REQUIRED_PROPERTIES.put("spring.data.mongodb.uri", "MONGO_URL");
        REQUIRED_PROPERTIES.put("spring.data.mongodb.database", "MONGO_DB_NAME");
        REQUIRED_PROPERTIES.put("app.security.jwt.secret", "JWT_SECRET_KEY");
    }

    static final Set<String> HMAC_ALGORITHMS = Set.of("HS256", "HS384", "HS512");

    private Environment environment;

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) {
        validate(environment);
    }

    /**
     * @throws IllegalStateException listing every missing or invalid setting
     */
    static void validate(Environment env) {
        List<String> problems = new ArrayList<>();
        REQUIRED_PROPERTIES.forEach((property, envVar) -> {
            if (ConfigHelper.isBlank(env.getProperty(property))) {
                problems.add("Missing required environment variable: " + envVar + " (" + property + ")");
            }
        });

        String algorithm = ConfigHelper.optionalProperty(env, "app.security.jwt.algorithm", "HS256");
        if (!HMAC_ALGORITHMS.contains(algorithm)) {
            problems.add("JWT_ALGORITHM must be one of " + HMAC_ALGORITHMS + " but was " + algorithm);
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(String.join("; ", problems));
        }
        logger.info("Required configuration validation passed.");
    }
}
