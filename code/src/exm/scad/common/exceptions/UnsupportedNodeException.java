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
package exm.scad.common.exceptions;

import exm.scad.ast.Span;

/**
 * The grammar produced a node kind the converter has no mapping for.
 * This means the grammar and the converter are out of step, so it should
 * be reported as a tool bug rather than as a problem in the user's file.
 */
public class UnsupportedNodeException extends ParseException {

  private final String nodeType;

  public UnsupportedNodeException(String nodeType, Span span) {
    super("unsupported node type '" + nodeType + "'", span);
    this.nodeType = nodeType;
  }

  public String getNodeType() {
    return nodeType;
  }

  private static final long serialVersionUID = 1L;
}
