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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticVersionTest {

  @Test
  public void testNumericOrdering() {
    assertTrue(SemanticVersion.isLessThan("1.2.0", "1.10.0"));
    assertFalse(SemanticVersion.isLessThan("1.10.0", "1.2.0"));
    assertFalse(SemanticVersion.isLessThan("1.2.0", "1.2.0"));
    assertTrue(SemanticVersion.isLessThan("1.2.0", "2.0"));
    assertTrue(SemanticVersion.isLessThan("2.4.8", "3.0.0"));
    assertFalse(SemanticVersion.isLessThan("3.5.1", "3.0.0"));
  }

  @Test
  public void testMissingComponentsAreZero() {
    assertEquals(SemanticVersion.parse("2.0"), SemanticVersion.parse("2.0.0"));
    assertEquals(SemanticVersion.parse("2.0").hashCode(), SemanticVersion.parse("2.0.0").hashCode());
    assertTrue(SemanticVersion.parse("2.0").compareTo(SemanticVersion.parse("1.2.0")) > 0);
    assertTrue(SemanticVersion.isLessThan("3", "3.0.1"));
  }

  @Test
  public void testPreReleaseSortsFirst() {
    assertTrue(SemanticVersion.isLessThan("1.3.0-rc1", "1.3.0"));
    assertFalse(SemanticVersion.isLessThan("1.3.0", "1.3.0-rc1"));
    assertTrue(SemanticVersion.isLessThan("1.3.0-rc1", "1.3.0-rc2"));
    assertTrue(SemanticVersion.isLessThan("1.2.9", "1.3.0-rc1"));
    assertTrue(SemanticVersion.parse("4.0.0-preview1").isPreRelease());
    assertFalse(SemanticVersion.parse("4.0.0").isPreRelease());
  }

  @Test
  public void testParse() {
    assertEquals("3.5.1", SemanticVersion.parse(" v3.5.1 ").toString());
    assertEquals(5, SemanticVersion.parse("3.5").component(1));
    assertEquals(0, SemanticVersion.parse("3.5").component(2));
  }

  @Test
  public void testInvalidVersions() {
    assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse(""));
    assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("abc"));
    assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("1..2"));
    assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("1.2."));
    assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse(null));
    assertThrows(IllegalArgumentException.class,
      () -> SemanticVersion.parse("99999999999.0"));
  }

}
