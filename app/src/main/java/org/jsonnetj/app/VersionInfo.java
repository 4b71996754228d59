// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.jsonnetj.app;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.antlr.v4.runtime.RuntimeMetaData;

/** Version of this build, the JVM it was built with, and the ANTLR runtime it parses with. */
public record VersionInfo(
    String version, String buildTimestamp, String builtWithJava, String antlrRuntime) {

  static final String RESOURCE = "build.properties";
  static final String UNKNOWN = "?";

  static VersionInfo load() throws IOException {
    var properties = new Properties();
    try (InputStream input = VersionInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (input != null) {
        properties.load(input);
      }
    }
    return fromProperties(properties);
  }

  static VersionInfo fromProperties(Properties properties) {
    return new VersionInfo(
        property(properties, "jsonnetj.version"),
        property(properties, "build.timestamp"),
        "%s %s"
            .formatted(property(properties, "java.vendor"), property(properties, "java.version")),
        RuntimeMetaData.VERSION);
  }

  // A resource that skipped Maven filtering still holds its ${...} placeholders.
  private static String property(Properties properties, String key) {
    String value = properties.getProperty(key, UNKNOWN).strip();
    return value.isEmpty() || value.startsWith("${") ? UNKNOWN : value;
  }

  @Override
  public String toString() {
    return "Jsonnetj %s (%s) [built with Java %s; ANTLR runtime %s]"
        .formatted(version, buildTimestamp, builtWithJava, antlrRuntime);
  }
}
