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
package exm.fnp.frontend;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.Logging;

/**
 * Logging of tree walks with indentation
 */
public class LogHelper {

  private static final Logger logger = Logging.getFnpLogger();

  public static void logChildren(int indent, ParseTree tree) {
    for (int i = 0; i < tree.getChildCount(); i++) {
      trace(indent+2, tree.child(i).getText());
    }
  }

  /**
   * @param tokenNum token number from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > FnParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return FnParser.tokenNames[tokenNum];
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

  public static void trace(int indent, ParseTree tree) {
    if (logger.isTraceEnabled()) {
      log(indent, Level.TRACE, tokName(tree.getType()) + " at " +
                               tree.location());
    }
  }

  public static void log(int indent, Level level, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    logger.log(level, StringUtils.repeat(' ', indent) + msg);
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
