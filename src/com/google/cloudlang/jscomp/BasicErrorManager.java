/*
 * Copyright 2024 The Closure Compiler Authors.
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

package com.google.cloudlang.jscomp;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that keeps diagnostics sorted and generates a report when the {@link
 * #generateReport()} method is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, JSError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledJSErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, JSError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<JSError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<JSError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<JSError> toList(CheckLevel level) {
    ImmutableList.Builder<JSError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the
   * {@link #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, JSError error);

  /**
   * Print the summary of the compilation - number of errors and warnings.
   */
  protected abstract void printSummary();

  /**
   * Comparator of {@link JSError} with an associated {@link CheckLevel}. The ordering is the
   * standard lexical ordering on the tuple ({@link CheckLevel}, file name, line number, character
   * number, diagnostic key, description). Errors without a file name sort first.
   */
  static final class LeveledJSErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<String> SOURCE_ORDER =
        Comparator.nullsFirst(Comparator.naturalOrder());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      int sourceCompare = SOURCE_ORDER.compare(p1.error.sourceName(), p2.error.sourceName());
      if (sourceCompare != 0) {
        return sourceCompare;
      }
      if (p1.error.lineno() != p2.error.lineno()) {
        return Integer.compare(p1.error.lineno(), p2.error.lineno());
      }
      if (p1.error.charno() != p2.error.charno()) {
        return Integer.compare(p1.error.charno(), p2.error.charno());
      }
      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final JSError error;
    final CheckLevel level;

    ErrorWithLevel(JSError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
