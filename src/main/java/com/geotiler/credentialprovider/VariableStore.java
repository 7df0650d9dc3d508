package com.geotiler.credentialprovider;

import java.util.Map;
import java.util.Objects;

/**
 * Process-wide name/value space a native consumer reads its credentials from.
 * <p>
 * Writers that need several changes to appear together synchronize on the store instance;
 * readers that need a consistent view do the same.
 */
public interface VariableStore {
  String get(String name);

  void set(String name, String value);

  void remove(String name);

  /**
   * Store over a mutable map, typically {@link ProcessBuilder#environment()} of the process that
   * hosts the native library.
   */
  static VariableStore of(Map<String, String> variables) {
    Objects.requireNonNull(variables, "variables");
    return new VariableStore() {
      @Override
      public String get(String name) {
        return variables.get(name);
      }

      @Override
      public void set(String name, String value) {
        variables.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      }

      @Override
      public void remove(String name) {
        variables.remove(name);
      }

      @Override
      public String toString() {
        return "VariableStore{map}";
      }
    };
  }

  /**
   * Store over JVM system properties, for consumers loaded into this JVM that read them.
   */
  static VariableStore systemProperties() {
    return new VariableStore() {
      @Override
      public String get(String name) {
        return System.getProperty(name);
      }

      @Override
      public void set(String name, String value) {
        System.setProperty(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      }

      @Override
      public void remove(String name) {
        System.clearProperty(name);
      }

      @Override
      public String toString() {
        return "VariableStore{systemProperties}";
      }
    };
  }
}
