package edu.jhu.hlt.tetre.util;

/**
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  public ExperimentProperties() {
    super();
  }

  /** Alternating keys and values, e.g. from main's args */
  public ExperimentProperties(String... keyValuePairs) {
    super();
    putAll(keyValuePairs);
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("need key/value pairs, got " + mainArgs.length + " args");
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new IllegalArgumentException(mainArgs[i] + " has two values: "
            + mainArgs[i+1] + " and " + old);
      }
    }
  }

  public int getInt(String key, int defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Integer.parseInt(value.trim());
  }

  public int getInt(String key) {
    return Integer.parseInt(getString(key).trim());
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("no value for " + key);
    return value;
  }
}
