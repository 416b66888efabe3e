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

import java.util.Optional;

import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.ParserRuleReturnScope;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.apache.log4j.Logger;

import exm.fnp.ast.FnLexer;
import exm.fnp.ast.ParseTree;
import exm.fnp.ast.antlr.FnParser;
import exm.fnp.common.Logging;
import exm.fnp.common.Settings;
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.common.exceptions.InvalidOptionException;
import exm.fnp.common.exceptions.InvalidSyntaxException;
import exm.fnp.frontend.tree.TypeTree;
import exm.fnp.tree.Assignment;
import exm.fnp.tree.AstNode;
import exm.fnp.tree.Block;
import exm.fnp.tree.Definition;
import exm.fnp.tree.Expression;
import exm.fnp.tree.Program;
import exm.fnp.tree.TypeInstance;

/**
 * Entry point for parsing source text into an AST.
 *
 * Parsing either produces an AST covering the whole input or nothing:
 * lexical errors, syntax errors, trailing input and structurally invalid
 * constructs all give an empty result.  Details are logged at DEBUG level.
 */
public class SourceParser {

  private static final Logger logger = Logging.getFnpLogger();

  /**
   * Grammar rules that can be used as parse targets
   */
  public static enum Rule {
    PROGRAM("program"),
    EXPR("expr"),
    TYPE_INSTANCE("type_instance"),
    BLOCK("block"),
    ASSIGNMENT("assignment"),
    TYPE_DEF("type_def"),
    TYPE_ALIAS("type_alias");

    private final String ruleName;

    private Rule(String ruleName) {
      this.ruleName = ruleName;
    }

    public String ruleName() {
      return ruleName;
    }

    /**
     * @return the rule, or null if no rule has this name
     */
    public static Rule fromName(String ruleName) {
      for (Rule rule: values()) {
        if (rule.ruleName.equals(ruleName)) {
          return rule;
        }
      }
      return null;
    }
  }

  public static Optional<AstNode> parse(String code, String ruleName) {
    Rule rule = Rule.fromName(ruleName);
    if (rule == null) {
      logger.debug("Unknown parse rule: " + ruleName);
      return Optional.empty();
    }
    return parse(code, rule);
  }

  public static Optional<AstNode> parse(String code, Rule rule) {
    FnLexer lexer = new FnLexer(code);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    tokens.fill();
    if (lexer.getNumberOfErrors() > 0) {
      logger.debug(lexer.getNumberOfErrors() + " lexical errors");
      return Optional.empty();
    }

    int maxNesting = maxNesting();
    if (lexer.getMaxNesting() > maxNesting) {
      Logging.uniqueWarn("Input nested over limit of " + maxNesting +
                         " set by " + Settings.MAX_NESTING);
      logger.debug("Input nested " + lexer.getMaxNesting() + " deep");
      return Optional.empty();
    }

    try {
      ParseTree tree = runANTLR(tokens, rule);
      if (tree == null) {
        return Optional.empty();
      }
      if (logger.isTraceEnabled()) {
        logger.trace(tree.printTree());
      }
      return Optional.of(walk(tree, rule));
    } catch (RecognitionException e) {
      logger.debug("Parse failed: " + e);
      return Optional.empty();
    } catch (InvalidSyntaxException e) {
      logger.debug("Invalid syntax: " + e.getMessage());
      return Optional.empty();
    } catch (StackOverflowError e) {
      // Long flat operator chains also recurse in the parser
      Logging.uniqueWarn("Input too deeply nested or too long to parse");
      return Optional.empty();
    }
  }

  public static Optional<Program> parseProgram(String code) {
    return narrow(parse(code, Rule.PROGRAM), Program.class);
  }

  public static Optional<Expression> parseExpression(String code) {
    return narrow(parse(code, Rule.EXPR), Expression.class);
  }

  public static Optional<TypeInstance> parseTypeInstance(String code) {
    return narrow(parse(code, Rule.TYPE_INSTANCE), TypeInstance.class);
  }

  public static Optional<Block> parseBlock(String code) {
    return narrow(parse(code, Rule.BLOCK), Block.class);
  }

  public static Optional<Assignment> parseAssignment(String code) {
    return narrow(parse(code, Rule.ASSIGNMENT), Assignment.class);
  }

  public static Optional<Definition> parseTypeDefinition(String code) {
    return narrow(parse(code, Rule.TYPE_DEF), Definition.class);
  }

  public static Optional<Definition> parseTypeAlias(String code) {
    return narrow(parse(code, Rule.TYPE_ALIAS), Definition.class);
  }

  private static <T extends AstNode> Optional<T> narrow(
                        Optional<AstNode> node, Class<T> cls) {
    if (!node.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(cls.cast(node.get()));
  }

  /**
   * Use ANTLR to parse the input for the given rule
   * @return the parse tree, or null if there were syntax errors or the
   *        rule did not consume all input
   */
  private static ParseTree runANTLR(CommonTokenStream tokens, Rule rule)
      throws RecognitionException {
    FnParser parser = new FnParser(tokens);
    parser.setTreeAdaptor(new FnTreeAdaptor());

    ParserRuleReturnScope result;
    switch (rule) {
      case PROGRAM:
        result = parser.program();
        break;
      case EXPR:
        result = parser.expr();
        break;
      case TYPE_INSTANCE:
        result = parser.type_instance();
        break;
      case BLOCK:
        result = parser.block();
        break;
      case ASSIGNMENT:
        result = parser.assignment();
        break;
      case TYPE_DEF:
        result = parser.type_def();
        break;
      case TYPE_ALIAS:
        result = parser.type_alias();
        break;
      default:
        throw new FnRuntimeError("Unknown rule " + rule);
    }

    if (parser.getNumberOfSyntaxErrors() > 0) {
      logger.debug(parser.getNumberOfSyntaxErrors() + " syntax errors");
      return null;
    }
    if (tokens.LA(1) != Token.EOF) {
      Token next = tokens.LT(1);
      logger.debug("Unexpected " + next.getText() + " at " + next.getLine() +
                   ":" + (next.getCharPositionInLine() + 1) +
                   " after " + rule.ruleName());
      return null;
    }
    return (ParseTree)result.getTree();
  }

  private static AstNode walk(ParseTree tree, Rule rule)
      throws InvalidSyntaxException {
    ASTWalker walker = new ASTWalker();
    switch (rule) {
      case PROGRAM:
        return walker.walkProgram(tree);
      case EXPR:
        return walker.getExprWalker().walk(tree);
      case TYPE_INSTANCE:
        return TypeTree.extractType(tree);
      case BLOCK:
        return walker.walkBlock(tree);
      case ASSIGNMENT:
        return walker.walkAssignment(tree);
      case TYPE_DEF:
      case TYPE_ALIAS:
        return walker.walkDefinition(tree);
      default:
        throw new FnRuntimeError("Unknown rule " + rule);
    }
  }

  private static int maxNesting() {
    try {
      return Settings.getInt(Settings.MAX_NESTING);
    } catch (InvalidOptionException e) {
      throw new FnRuntimeError("Bad setting: " + e.getMessage(), e);
    }
  }

  /**
   * Have ANTLR build our tree class
   */
  private static class FnTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new ParseTree(t);
    }

    @Override
    public Object dupNode(Object t) {
      if (t == null) {
        return null;
      }
      return create(((CommonTree)t).getToken());
    }
  }
}
