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
package exm.fnp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.TokenSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;

import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.Logging;

/**
 * Token source for {@link FnParser}.
 *
 * Several tokenization decisions depend on context: a <code>&gt;</code>
 * closes a generic argument list opened with <code>.&lt;</code> only while
 * one is open, a run of dots is an operator only after whitespace, and
 * <code>__name__</code> / <code>__op__</code> are distinguished from
 * ordinary identifiers.  These are handled here rather than in an ANTLR
 * lexer grammar.
 *
 * Errors are counted and logged; tokenization continues so that the
 * caller sees all problems in the log, but any error means the input is
 * rejected.
 */
public class FnLexer implements TokenSource {

  private static final Logger logger = Logging.getFnpLogger();

  private static final String OPERATOR_CHARS = "&!+/-^$<>@:*|%=.";

  private static final Pattern NAME =
                  Pattern.compile("[A-Za-z_][A-Za-z0-9_]*'*");

  /** Infix use of a named function: 3 __add__ 4 */
  private static final Pattern INFIX_NAME =
                  Pattern.compile("__[A-Za-z_][A-Za-z0-9_]*'*__");

  private static final Map<String, Integer> keywords;

  /** Operator-character runs with a token type of their own */
  private static final Map<String, Integer> specialOperators;

  static {
    ImmutableMap.Builder<String, Integer> kw = ImmutableMap.builder();
    kw.put("typedef", FnParser.TYPEDEF);
    kw.put("typealias", FnParser.TYPEALIAS);
    kw.put("if", FnParser.IF);
    kw.put("else", FnParser.ELSE);
    kw.put("match", FnParser.MATCH);
    kw.put("true", FnParser.TRUE);
    kw.put("false", FnParser.FALSE);
    kw.put("int", FnParser.INT_TYPE);
    kw.put("bool", FnParser.BOOL_TYPE);
    keywords = kw.build();

    ImmutableMap.Builder<String, Integer> ops = ImmutableMap.builder();
    ops.put("=", FnParser.ASSIGN);
    ops.put("->", FnParser.ARROW);
    ops.put("|", FnParser.BAR);
    ops.put("<", FnParser.LT);
    ops.put(">", FnParser.GT);
    ops.put("<>", FnParser.EMPTY_PARAMS);
    ops.put(":", FnParser.COLON);
    ops.put("-", FnParser.MINUS);
    specialOperators = ops.build();
  }

  private final String input;
  private final String sourceName;

  private int pos = 0;
  private int line = 1;
  private int col = 0;

  /** Number of open .< generic argument lists */
  private int genericDepth = 0;

  private int nesting = 0;
  private int maxNesting = 0;

  /** Whether whitespace or a comment precedes the current token */
  private boolean afterWhitespace = true;

  private final List<String> errors = new ArrayList<String>();

  public FnLexer(String input, String sourceName) {
    this.input = input;
    this.sourceName = sourceName;
  }

  public FnLexer(String input) {
    this(input, "<string>");
  }

  @Override
  public String getSourceName() {
    return sourceName;
  }

  public int getNumberOfErrors() {
    return errors.size();
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * @return deepest bracket nesting seen so far, counting parentheses,
   *        braces and generic argument lists
   */
  public int getMaxNesting() {
    return maxNesting;
  }

  @Override
  public Token nextToken() {
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        CommonToken eof = new CommonToken(Token.EOF, "<EOF>");
        eof.setLine(line);
        eof.setCharPositionInLine(col);
        eof.setStartIndex(pos);
        eof.setStopIndex(pos - 1);
        return eof;
      }
      Token t = scanToken();
      if (t != null) {
        afterWhitespace = false;
        return t;
      }
      // Bad input was skipped, keep going
      afterWhitespace = false;
    }
  }

  private void skipWhitespace() {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        advance(1);
      } else if (input.startsWith("//", pos)) {
        int end = input.indexOf('\n', pos);
        advance((end < 0 ? input.length() : end) - pos);
      } else if (input.startsWith("/*", pos)) {
        // Block comments do not nest
        int end = input.indexOf("*/", pos + 2);
        if (end < 0) {
          error("Unterminated block comment");
          advance(input.length() - pos);
        } else {
          advance(end + 2 - pos);
        }
      } else {
        return;
      }
      afterWhitespace = true;
    }
  }

  /**
   * Scan one token starting at pos
   * @return the token, or null if the input was invalid and skipped
   */
  private Token scanToken() {
    char c = input.charAt(pos);
    if (isDigit(c)) {
      return scanInteger();
    } else if (isLetter(c) || c == '_') {
      if (input.startsWith("__", pos) && pos + 2 < input.length() &&
          isOperatorChar(input.charAt(pos + 2))) {
        return scanOperatorId();
      }
      return scanWord();
    } else if (c == '.' && pos + 1 < input.length() &&
               input.charAt(pos + 1) == '<') {
      genericDepth++;
      open();
      return makeToken(FnParser.GENERIC_OPEN, 2);
    } else if (c == '.' && pos + 1 < input.length() &&
               isDigit(input.charAt(pos + 1))) {
      return makeToken(FnParser.DOT, 1);
    } else if (isOperatorChar(c)) {
      return scanOperator();
    }

    switch (c) {
      case '(':
        open();
        return makeToken(FnParser.LPAREN, 1);
      case ')':
        close();
        return makeToken(FnParser.RPAREN, 1);
      case '{':
        open();
        return makeToken(FnParser.LBRACE, 1);
      case '}':
        close();
        return makeToken(FnParser.RBRACE, 1);
      case ',':
        return makeToken(FnParser.COMMA, 1);
      case ';':
        return makeToken(FnParser.SEMI, 1);
      default:
        error("Unexpected character '" + c + "'");
        advance(1);
        return null;
    }
  }

  private Token scanInteger() {
    int end = pos;
    while (end < input.length() && isDigit(input.charAt(end))) {
      end++;
    }
    if (end - pos > 1 && input.charAt(pos) == '0') {
      error("Integer literal with leading zero: " + input.substring(pos, end));
    }
    return makeToken(FnParser.UINT, end - pos);
  }

  /**
   * Identifier, keyword, or __name__
   */
  private Token scanWord() {
    int end = pos;
    while (end < input.length() && isWordChar(input.charAt(end))) {
      end++;
    }
    String text = input.substring(pos, end);

    if (INFIX_NAME.matcher(text).matches()) {
      return makeToken(FnParser.INFIX_ID, end - pos);
    } else if (!NAME.matcher(text).matches()) {
      error("Malformed identifier: " + text);
      advance(end - pos);
      return null;
    }

    if (text.length() >= 2 && StringUtils.containsOnly(text, '_') &&
        end < input.length() && isOperatorChar(input.charAt(end))) {
      // Something like ___+__, not an operator identifier
      error("Malformed operator identifier starting with " + text);
      advance(end - pos);
      return null;
    }

    Integer keyword = keywords.get(text);
    if (keyword != null) {
      return makeToken(keyword, end - pos);
    }
    return makeToken(FnParser.ID, end - pos);
  }

  /**
   * Operator used as a name: __+__
   */
  private Token scanOperatorId() {
    int opEnd = pos + 2;
    while (opEnd < input.length() && isOperatorChar(input.charAt(opEnd))) {
      opEnd++;
    }
    String op = input.substring(pos + 2, opEnd);
    int end = opEnd + 2;
    if (!input.startsWith("__", opEnd) ||
        (end < input.length() && isWordChar(input.charAt(end)))) {
      error("Malformed operator identifier: " + input.substring(pos, opEnd));
      advance(opEnd - pos);
      return null;
    }
    if (op.equals("=") || op.indexOf('.') >= 0) {
      error("Operator cannot be used as identifier: " + op);
      advance(end - pos);
      return null;
    }
    return makeToken(FnParser.OPERATOR_ID, end - pos);
  }

  private Token scanOperator() {
    if (genericDepth > 0) {
      // Close generic argument lists one '>' at a time, so that
      // f.<g.<T>> works
      if (input.startsWith("->", pos)) {
        return makeToken(FnParser.ARROW, 2);
      } else if (input.charAt(pos) == '>') {
        genericDepth--;
        close();
        return makeToken(FnParser.GT, 1);
      }
    }

    int end = pos;
    while (end < input.length() && isOperatorChar(input.charAt(end))) {
      if (end > pos && input.charAt(end) == '/' && end + 1 < input.length() &&
          (input.charAt(end + 1) == '/' || input.charAt(end + 1) == '*')) {
        // Comment starts
        break;
      }
      end++;
    }
    String text = input.substring(pos, end);

    if (text.indexOf('.') >= 0) {
      if (!StringUtils.containsOnly(text, '.')) {
        error("Operator cannot contain '.': " + text);
        advance(end - pos);
        return null;
      } else if (!afterWhitespace) {
        error("Operator " + text + " must be preceded by whitespace");
        advance(end - pos);
        return null;
      }
      return makeToken(FnParser.OPERATOR, end - pos);
    }

    Integer special = specialOperators.get(text);
    if (special != null) {
      return makeToken(special, end - pos);
    }
    return makeToken(FnParser.OPERATOR, end - pos);
  }

  private Token makeToken(int type, int length) {
    CommonToken t = new CommonToken(type, input.substring(pos, pos + length));
    t.setLine(line);
    t.setCharPositionInLine(col);
    t.setStartIndex(pos);
    t.setStopIndex(pos + length - 1);
    advance(length);
    return t;
  }

  private void advance(int n) {
    for (int i = 0; i < n; i++) {
      if (input.charAt(pos) == '\n') {
        line++;
        col = 0;
      } else {
        col++;
      }
      pos++;
    }
  }

  private void open() {
    nesting++;
    maxNesting = Math.max(maxNesting, nesting);
  }

  private void close() {
    nesting = Math.max(0, nesting - 1);
  }

  private void error(String msg) {
    String full = sourceName + ":" + line + ":" + (col + 1) + ": " + msg;
    logger.debug("Lexical error " + full);
    errors.add(full);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isWordChar(char c) {
    return isLetter(c) || isDigit(c) || c == '_' || c == '\'';
  }

  public static boolean isOperatorChar(char c) {
    return OPERATOR_CHARS.indexOf(c) >= 0;
  }
}
