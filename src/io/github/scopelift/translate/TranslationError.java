/*
 * Copyright 2026 The Scopelift Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.scopelift.translate;

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.github.scopelift.codemodel.Statement;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic reported while translating a function.
 *
 * @param type the kind of problem
 * @param description the formatted message
 * @param functionName the function being translated, if known
 * @param lineno the source line of the offending statement, or -1
 * @param location the statement path of the offending statement, such as {@code if#3 > while#5}
 */
public record TranslationError(
    DiagnosticType type,
    String description,
    @Nullable String functionName,
    int lineno,
    @Nullable String location) {
  public TranslationError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /** Creates an error with no location. */
  public static TranslationError make(DiagnosticType type, String... arguments) {
    return builder(type, arguments).build();
  }

  static Builder builder(DiagnosticType type, String... arguments) {
    return new Builder(type, arguments);
  }

  /** The default level of the error's type. */
  public CheckLevel getDefaultLevel() {
    return type.level;
  }

  /** Formats the error the way the logging error manager prints it. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (functionName != null) {
      sb.append(functionName);
      if (lineno > 0) {
        sb.append(':').append(lineno);
      }
      sb.append(": ");
    }
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    if (location != null) {
      sb.append(" (at ").append(location).append(')');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return format(type.level);
  }

  static final class Builder {
    private final DiagnosticType type;
    private final String[] arguments;

    private @Nullable String functionName;
    private int lineno = -1;
    private @Nullable String location;

    private Builder(DiagnosticType type, String... arguments) {
      this.type = type;
      this.arguments = arguments;
    }

    @CanIgnoreReturnValue
    Builder setFunctionName(String functionName) {
      this.functionName = functionName;
      return this;
    }

    /** Sets the position from the offending statement. */
    @CanIgnoreReturnValue
    Builder setStatement(Statement statement) {
      this.lineno = statement.getLineno();
      return this;
    }

    @CanIgnoreReturnValue
    Builder setLocation(String location) {
      this.location = location;
      return this;
    }

    TranslationError build() {
      return new TranslationError(type, type.format(arguments), functionName, lineno, location);
    }
  }
}
