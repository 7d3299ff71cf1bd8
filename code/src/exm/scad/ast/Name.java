/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.scad.ast;

/**
 * An identifier together with the span it was written at
 */
public class Name extends Node {
  public static final char SPECIAL_SIGIL = '$';

  private final String id;

  public Name(String id, Span span) {
    super(span);
    assert(id != null && id.length() > 0);
    this.id = id;
  }

  public String getId() {
    return id;
  }

  /**
   * @return true for special variables such as $fn
   */
  public boolean isSpecial() {
    return isSpecial(id);
  }

  public static boolean isSpecial(String id) {
    return id.length() > 0 && id.charAt(0) == SPECIAL_SIGIL;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Name))
      return false;
    return id.equals(((Name)obj).id);
  }

  @Override
  public String toString() {
    return id;
  }
}
