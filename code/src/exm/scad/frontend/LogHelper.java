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
package exm.scad.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.scad.common.Logging;
import exm.scad.cst.CstNode;

/**
 * Indented logging for tree walks, so that nesting in the log follows
 * nesting in the source.
 */
public class LogHelper {
  static final Logger logger = Logging.getScadLogger();

  /**
     TRACE-level line describing a CST node
   */
  public static void traceNode(int indent, CstNode node) {
    if (logger.isTraceEnabled()) {
      trace(indent, node.kind() + " " + node.span());
    }
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  public static void log(int indent, Level level, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb);
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
