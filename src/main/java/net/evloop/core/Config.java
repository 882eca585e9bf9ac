package net.evloop.core;

import static com.google.common.base.Strings.emptyToNull;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import net.evloop.core.exceptions.ConfigException;
import net.evloop.core.util.Durations;
import org.immutables.value.Value;

/**
 * Runtime configuration. Each option is read from the environment first (upper-cased with dots
 * and camel-case humps turned into underscores, so {@code loop.asyncWorkers} becomes
 * {@code LOOP_ASYNC_WORKERS}), then from {@code evloop.properties} and finally from
 * {@code evloop-defaults.properties} on the classpath.
 */
@Value.Immutable
public interface Config {
  @Option("loop.asyncWorkers")
  Integer loopAsyncWorkers();

  @Option("loop.asyncDeadline")
  Optional<Duration> loopAsyncDeadline();

  @Option("files.dir")
  Path filesDir();

  @Option("files.placeholder")
  String filesPlaceholder();

  @Option("fetch.baseUri")
  URI fetchBaseUri();

  @Option("fetch.connectTimeout")
  Duration fetchConnectTimeout();

  @Value.Check
  default void check() {
    Preconditions.checkState(loopAsyncWorkers() > 0, "loop.asyncWorkers must be positive");
    loopAsyncDeadline().ifPresent(d -> Preconditions.checkState(
        !d.isNegative() && !d.isZero(), "loop.asyncDeadline must be positive"));
  }

  static Config load() throws IOException {
    var classLoader = Config.class.getClassLoader();
    var properties = loadProperties(classLoader);

    InvocationHandler handler = (proxy, method, args) -> {
      var option = method.getAnnotation(Option.class);
      if (option != null) {
        var valueName = option.value();
        var valueStr = readStringOption(properties, valueName);
        var type = method.getReturnType();

        if (Optional.class.equals(type)) {
          if (valueStr == null) {
            return Optional.empty();
          }

          var optionalType = (Class<?>) ((ParameterizedType) method.getGenericReturnType())
              .getActualTypeArguments()[0];

          return Optional.of(parseOption(valueName, optionalType, valueStr));
        }

        if (valueStr == null) {
          throw new ConfigException("missing required option: " + valueName);
        }

        return parseOption(valueName, type, valueStr);
      }

      throw new UnsupportedOperationException();
    };

    // Use a temporary proxy to initialize the ImmutableConfig
    return ImmutableConfig.copyOf(
        (Config) Proxy.newProxyInstance(classLoader, new Class<?>[]{Config.class}, handler));
  }

  private static Properties loadProperties(ClassLoader classLoader) throws IOException {
    var defaults = new Properties();
    try (var in = classLoader.getResourceAsStream("evloop-defaults.properties")) {
      if (in != null) {
        defaults.load(in);
      }
    }

    var properties = new Properties(defaults);
    try (var in = classLoader.getResourceAsStream("evloop.properties")) {
      if (in != null) {
        properties.load(in);
      }
    }

    return properties;
  }

  static String envVarName(String name) {
    return name
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('.', '_')
        .toUpperCase();
  }

  private static String readStringOption(Properties properties, String name) {
    var value = emptyToNull(System.getenv(envVarName(name)));
    if (value != null) {
      return value;
    }

    return emptyToNull(properties.getProperty(name));
  }

  static Object parseOption(String name, Class<?> type, String value) {
    try {
      if (type.isAssignableFrom(String.class)) {
        return value;
      }

      if (type.isAssignableFrom(Integer.class)) {
        return Integer.valueOf(value.strip());
      }

      if (type.isAssignableFrom(Path.class)) {
        return Path.of(value);
      }

      if (type.isAssignableFrom(URI.class)) {
        return URI.create(value.strip());
      }

      if (type.isAssignableFrom(Duration.class)) {
        return Durations.fromString(value);
      }
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new ConfigException("invalid value for option " + name + ": " + value, e);
    }

    throw new IllegalArgumentException("unsupported type: " + type);
  }

  @Target(ElementType.METHOD)
  @Retention(RetentionPolicy.RUNTIME)
  @interface Option {
    String value();
  }
}
