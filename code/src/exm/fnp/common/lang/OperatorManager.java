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
package exm.fnp.common.lang;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Precedence and associativity of infix operators.  Any non-empty run of
 * operator characters is a valid operator; the operators listed here have
 * a fixed precedence, all others get {@link #UNKNOWN_PRECEDENCE}.
 *
 * Precedence numbers increase as operators bind more loosely.
 */
public class OperatorManager {

  public static enum Associativity {
    LEFT, RIGHT, NONE
  }

  /** Precedence of a token that is not a valid operator */
  public static final int INVALID_PRECEDENCE = -2;

  /** Precedence of a valid operator not in the table */
  public static final int UNKNOWN_PRECEDENCE = -1;

  private static final Pattern OPERATOR_PATTERN =
                              Pattern.compile("^[&!+/\\-^$<>@:*|%=.]+$");

  private static final Map<String, Integer> precedences;

  private static final Set<String> leftAssociative = ImmutableSet.of(
                              "$", "@", "::", "**", "++", "--");

  private static final Set<String> nonAssociative = ImmutableSet.of(
                              "<", "<=", ">", ">=", "<=>", "==", "!=");

  static {
    ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    b.put("@", 2);
    b.put("**", 3);
    b.put("*", 4);
    b.put("/", 5);
    b.put("%", 6);
    b.put("+", 7);
    b.put("-", 7);
    b.put(">>", 8);
    b.put("<<", 8);
    b.put("::", 9);
    b.put("++", 9);
    b.put("--", 9);
    b.put("<=>", 10);
    for (String cmp: new String[] {"<", "<=", ">", ">=", "==", "!="}) {
      b.put(cmp, 11);
    }
    b.put("&", 12);
    b.put("^", 13);
    b.put("|", 14);
    b.put("&&", 15);
    b.put("||", 16);
    b.put("|>", 17);
    b.put("$", 18);
    precedences = b.build();
  }

  /**
   * @param token
   * @return true if token consists only of operator characters
   */
  public static boolean checkOperator(String token) {
    return token != null && OPERATOR_PATTERN.matcher(token).matches();
  }

  /**
   * @param token
   * @return precedence of operator, {@link #UNKNOWN_PRECEDENCE} if it is a
   *    valid but unlisted operator, {@link #INVALID_PRECEDENCE} if not an
   *    operator at all
   */
  public static int getPrecedence(String token) {
    if (!checkOperator(token)) {
      return INVALID_PRECEDENCE;
    }
    Integer prec = precedences.get(token);
    if (prec == null) {
      return UNKNOWN_PRECEDENCE;
    }
    return prec;
  }

  public static Associativity getAssociativity(String token) {
    if (!checkOperator(token) || leftAssociative.contains(token)) {
      return Associativity.LEFT;
    } else if (nonAssociative.contains(token)) {
      return Associativity.NONE;
    } else {
      return Associativity.RIGHT;
    }
  }
}
