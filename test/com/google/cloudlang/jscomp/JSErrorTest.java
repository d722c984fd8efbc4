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

import static com.google.common.truth.Truth.assertThat;

import com.google.cloudlang.ast.IR;
import com.google.cloudlang.ast.Node;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link JSError} and its rendering by {@link PrintStreamErrorManager}. */
@RunWith(JUnit4.class)
public final class JSErrorTest {

  private static final DiagnosticType BAD_THING =
      DiagnosticType.error("TEST_BAD_THING", "bad {0} in {1}");

  @Test
  public void testDescriptionIsFormatted() {
    JSError error = JSError.make(BAD_THING, "x", "f");

    assertThat(error.description()).isEqualTo("bad x in f");
    assertThat(error.defaultLevel()).isEqualTo(CheckLevel.ERROR);
    assertThat(error.sourceName()).isNull();
    assertThat(error.lineno()).isEqualTo(-1);
  }

  @Test
  public void testNodePosition() {
    Node n = IR.name("x").withLinenoCharno(3, 7);
    JSError error = JSError.make(n, BAD_THING, "x", "f");

    assertThat(error.node()).isSameInstanceAs(n);
    assertThat(error.lineno()).isEqualTo(3);
    assertThat(error.charno()).isEqualTo(7);
  }

  @Test
  public void testWithSourceName() {
    JSError error = JSError.make(IR.name("x").withLinenoCharno(3, 7), BAD_THING, "x", "f");

    JSError named = error.withSourceName("in.json");

    assertThat(named.sourceName()).isEqualTo("in.json");
    assertThat(named.lineno()).isEqualTo(3);
    assertThat(named.description()).isEqualTo(error.description());
  }

  @Test
  public void testToString() {
    assertThat(JSError.make("in.json", 2, 4, BAD_THING, "x", "f").toString())
        .isEqualTo("TEST_BAD_THING. bad x in f at in.json line 2 : 4");
    assertThat(JSError.make(BAD_THING, "x", "f").toString())
        .isEqualTo(
            "TEST_BAD_THING. bad x in f at (unknown source)"
                + " line (unknown line) : (unknown column)");
  }

  @Test
  public void testFormat() {
    JSError error = JSError.make("in.json", 2, 4, BAD_THING, "x", "f");

    assertThat(error.format(CheckLevel.ERROR))
        .isEqualTo("in.json:2: ERROR - [TEST_BAD_THING] bad x in f");
    assertThat(error.format(CheckLevel.WARNING))
        .isEqualTo("in.json:2: WARNING - [TEST_BAD_THING] bad x in f");
    assertThat(error.format(CheckLevel.OFF)).isNull();
    assertThat(JSError.make(BAD_THING, "x", "f").format(CheckLevel.ERROR))
        .isEqualTo("ERROR - [TEST_BAD_THING] bad x in f");
  }

  @Test
  public void testPrintStreamErrorManager() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStreamErrorManager manager = new PrintStreamErrorManager(new PrintStream(bytes, true));
    manager.report(CheckLevel.ERROR, JSError.make("in.json", 2, 4, BAD_THING, "x", "f"));
    manager.generateReport();

    assertThat(bytes.toString())
        .isEqualTo(
            "in.json:2: ERROR - [TEST_BAD_THING] bad x in f"
                + System.lineSeparator()
                + "1 error(s), 0 warning(s)"
                + System.lineSeparator());
  }

  @Test
  public void testPrintStreamErrorManagerSummaryDetail() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStreamErrorManager manager = new PrintStreamErrorManager(new PrintStream(bytes, true));
    manager.generateReport();
    assertThat(bytes.toString()).isEmpty();

    manager.setSummaryDetailLevel(2);
    manager.generateReport();
    assertThat(bytes.toString()).isEqualTo("0 error(s), 0 warning(s)" + System.lineSeparator());
  }
}
