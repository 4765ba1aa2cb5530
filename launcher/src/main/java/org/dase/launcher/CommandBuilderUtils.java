/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.dase.launcher;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Helper methods for command builders.
 */
class CommandBuilderUtils {

  static final String DEFAULT_MEM = "1g";
  static final String DEFAULT_PROPERTIES_FILE = "dase-defaults.conf";
  static final String ENV_DASE_HOME = "DASE_HOME";
  static final String ENV_SPARK_HOME = "SPARK_HOME";
  static final String ENV_JAVA_HOME = "JAVA_HOME";

  /** Returns whether the given string is null or empty. */
  static boolean isEmpty(String s) {
    return s == null || s.isEmpty();
  }

  /** Joins a list of strings using the given separator. */
  static String join(String sep, String... elements) {
    return join(sep, Arrays.asList(elements));
  }

  /** Joins a list of strings using the given separator, skipping nulls. */
  static String join(String sep, Iterable<String> elements) {
    StringBuilder sb = new StringBuilder();
    for (String e : elements) {
      if (e != null) {
        if (sb.length() > 0) {
          sb.append(sep);
        }
        sb.append(e);
      }
    }
    return sb.toString();
  }

  /** Returns the first non-empty, non-null string in the given list, or null otherwise. */
  static String firstNonEmpty(String... candidates) {
    for (String s : candidates) {
      if (!isEmpty(s)) {
        return s;
      }
    }
    return null;
  }

  /** Returns whether the OS is Windows. */
  static boolean isWindows() {
    String os = System.getProperty("os.name");
    return os.startsWith("Windows");
  }

  /** Name of the java executable on the current OS. */
  static String javaExecutableName() {
    return isWindows() ? "java.exe" : "java";
  }

  /**
   * Parse a string as if it were a list of arguments, following bash semantics. Used to split
   * JAVA_OPTS and the extra java options from the defaults file.
   *
   * Input: "\"ab cd\" efgh 'i \" j'"
   * Output: [ "ab cd", "efgh", "i \" j" ]
   */
  static List<String> parseOptionString(String s) {
    List<String> opts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char quote = 0;
    boolean escaped = false;
    // Tracks whether a token was started, so that '' and "" yield an empty argument.
    boolean started = false;

    for (int i = 0; i < s.length(); i++) {
      int c = s.codePointAt(i);
      if (escaped) {
        current.appendCodePoint(c);
        escaped = false;
        continue;
      }

      if (quote == '\'') {
        if (c == '\'') {
          quote = 0;
        } else {
          current.appendCodePoint(c);
        }
      } else if (quote == '"') {
        if (c == '"') {
          quote = 0;
        } else if (c == '\\') {
          escaped = true;
        } else {
          current.appendCodePoint(c);
        }
      } else if (c == '\'' || c == '"') {
        quote = (char) c;
        started = true;
      } else if (c == '\\') {
        escaped = true;
        started = true;
      } else if (Character.isWhitespace(c)) {
        if (started) {
          opts.add(current.toString());
          current.setLength(0);
          started = false;
        }
      } else {
        current.appendCodePoint(c);
        started = true;
      }
    }

    checkArgument(quote == 0 && !escaped, "Invalid option string: %s", s);
    if (started) {
      opts.add(current.toString());
    }
    return opts;
  }

  /** Throws IllegalArgumentException if the given object is null. */
  static void checkNotNull(Object o, String arg) {
    if (o == null) {
      throw new IllegalArgumentException(String.format("'%s' must not be null.", arg));
    }
  }

  /** Throws IllegalArgumentException with the given message if the check is false. */
  static void checkArgument(boolean check, String msg, Object... args) {
    if (!check) {
      throw new IllegalArgumentException(String.format(msg, args));
    }
  }

  /** Throws IllegalStateException with the given message if the check is false. */
  static void checkState(boolean check, String msg, Object... args) {
    if (!check) {
      throw new IllegalStateException(String.format(msg, args));
    }
  }

  /**
   * Quote a command argument for a command to be run by a Windows batch script, if the argument
   * needs quoting. Quotes within arguments are doubled, which is how batch escapes them.
   *
   *  For example:
   *    original single argument: ab="cde fgh"
   *    quoted: "ab=""cde fgh"""
   */
  static String quoteForBatchScript(String arg) {
    boolean needsQuotes = arg.codePoints().anyMatch(c ->
      Character.isWhitespace(c) || c == '"' || c == '=' || c == ',' || c == ';');
    if (!needsQuotes) {
      return arg;
    }
    StringBuilder quoted = new StringBuilder("\"");
    arg.codePoints().forEach(cp -> {
      if (cp == '"') {
        quoted.append('"');
      }
      quoted.appendCodePoint(cp);
    });
    if (arg.endsWith("\\")) {
      quoted.append('\\');
    }
    return quoted.append('"').toString();
  }

  /**
   * Find the directory holding the toolkit jars, depending on whether we're looking at a
   * distribution ("lib") or a build directory ("assembly/target/lib").
   */
  static String findLibDir(String daseHome, boolean failIfNotFound) {
    File libdir = new File(daseHome, "lib");
    if (!libdir.isDirectory()) {
      libdir = new File(daseHome, join(File.separator, "assembly", "target", "lib"));
      if (!libdir.isDirectory()) {
        checkState(!failIfNotFound,
          "Library directory '%s' does not exist; make sure the toolkit is built.",
          libdir.getAbsolutePath());
        return null;
      }
    }
    return libdir.getAbsolutePath();
  }

}
