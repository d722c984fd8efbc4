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

package com.google.cloudlang.jscomp.parsing;

/** Thrown when an ESTree JSON document cannot be converted into an AST. */
public class EstreeParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int lineno;
  private final int charno;

  public EstreeParseException(String message) {
    this(message, -1, -1);
  }

  /**
   * @param lineno one-indexed line of the offending node, or -1 if unknown
   * @param charno zero-indexed column of the offending node, or -1 if unknown
   */
  public EstreeParseException(String message, int lineno, int charno) {
    super(message);
    this.lineno = lineno;
    this.charno = charno;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }
}
