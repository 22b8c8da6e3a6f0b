package org.broadinstitute.pileup.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Singleton front end to the {@link org.aeonbits.owner} configuration utilities.
 *
 * Config interfaces name their optional override files through {@code ${...}} variables in their
 * {@link org.aeonbits.owner.Config.Sources} annotation. Before a configuration is created, every such variable that
 * is set neither as a system property, an environment variable nor an owner property is pointed at an empty file,
 * so that the source is skipped and loading falls through to the next one.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    private ConfigFactory() {}

    private static final Pattern PATH_VARIABLE_PATTERN = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value given to a path variable that nobody set
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> resolvedConfigClasses = new HashSet<>();

    /**
     * Create a new configuration of type {@code configClass}. Every call returns a separate instance, so changes made
     * through {@link org.aeonbits.owner.Mutable#setProperty} stay local to it.
     *
     * @param configClass the config interface to instantiate
     */
    public <T extends Config> T create(final Class<? extends T> configClass) {
        Utils.nonNull(configClass);
        resolvePathVariables(configClass);
        return org.aeonbits.owner.ConfigFactory.create(configClass);
    }

    /**
     * @return a new {@link PileupConfig}
     */
    public PileupConfig createPileupConfig() {
        return create(PileupConfig.class);
    }

    private synchronized void resolvePathVariables(final Class<? extends Config> configClass) {
        if ( resolvedConfigClasses.add(configClass) ) {
            neutralizeUnsetPathVariables(getPathVariableNames(configClass));
        }
    }

    @VisibleForTesting
    void neutralizeUnsetPathVariables(final List<String> variableNames) {
        final Map<String, String> environment = System.getenv();
        final Properties systemProperties = System.getProperties();

        for ( final String name : variableNames ) {
            final String value;
            if ( environment.containsKey(name) ) {
                value = environment.get(name);
            } else if ( systemProperties.containsKey(name) ) {
                value = systemProperties.getProperty(name);
            } else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(name) ) {
                value = org.aeonbits.owner.ConfigFactory.getProperty(name);
            } else {
                logger.debug("Config path variable {} is not set, using {}", name, NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(name, NO_PATH_VARIABLE_VALUE);
                continue;
            }
            logger.debug("Config path variable {} = {}, will search for config there", name, value);
        }
    }

    @VisibleForTesting
    static List<String> getPathVariableNames(final Class<?> configClass) {
        final Config.Sources sources = configClass.getAnnotation(Config.Sources.class);
        if ( sources == null ) {
            return Collections.emptyList();
        }
        final List<String> names = new ArrayList<>();
        for ( final String source : sources.value() ) {
            final Matcher m = PATH_VARIABLE_PATTERN.matcher(source);
            if ( m.find() ) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    /**
     * Log every property of {@code config} with its current value at DEBUG.
     */
    public static <T extends Config> void logConfigFields(final T config) {
        Utils.nonNull(config);
        if ( !logger.isDebugEnabled() ) {
            return;
        }
        logger.debug("Configuration values for {}:", config.getClass().getSimpleName());
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.debug("\t{} = {}", entry.getKey(), entry.getValue());
        }
    }

    /**
     * @return property name (the {@link org.aeonbits.owner.Config.Key} where there is one) to current value, for every
     * property declared by the config interfaces {@code config} implements
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap(final T config) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // the proxy class itself has many unrelated methods, so only the declared config interfaces are inspected
        for ( final Class<?> configInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(configInterface) ) {
                continue;
            }
            for ( final Method getter : configInterface.getDeclaredMethods() ) {
                final Config.Key key = getter.getAnnotation(Config.Key.class);
                final String name = key != null ? key.value() : getter.getName();
                try {
                    configMap.put(name, getter.invoke(config));
                } catch ( final IllegalAccessException | InvocationTargetException e ) {
                    throw new PileupException("Could not read config property " + configInterface.getSimpleName() + "." + getter.getName(), e);
                }
            }
        }
        return configMap;
    }
}
