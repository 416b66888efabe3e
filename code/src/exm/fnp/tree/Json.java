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
package exm.fnp.tree;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Helpers for the JSON projection of the AST.
 *
 * Fields whose declared type is one of the sum types ({@link TypeInstance},
 * {@link Expression}, {@link Definition}) are wrapped as
 * <code>{"VariantName": {...}}</code> so that consumers can tell the
 * variants apart.  Fields with a single concrete node type are emitted
 * directly.
 */
public class Json {

  private static final Gson gson = new GsonBuilder()
                          .serializeNulls()
                          .disableHtmlEscaping()
                          .create();

  private static final Gson prettyGson = new GsonBuilder()
                          .serializeNulls()
                          .disableHtmlEscaping()
                          .setPrettyPrinting()
                          .create();

  /**
   * Wrap node in an object keyed by its variant name
   */
  public static JsonObject variant(AstNode node) {
    JsonObject wrapper = new JsonObject();
    wrapper.add(node.nodeName(), node.toJson());
    return wrapper;
  }

  /**
   * As {@link #variant(AstNode)}, but null becomes JSON null
   */
  public static JsonElement optionalVariant(AstNode node) {
    if (node == null) {
      return JsonNull.INSTANCE;
    }
    return variant(node);
  }

  public static JsonElement optionalNode(AstNode node) {
    if (node == null) {
      return JsonNull.INSTANCE;
    }
    return node.toJson();
  }

  public static JsonArray variants(List<? extends AstNode> nodes) {
    JsonArray arr = new JsonArray();
    for (AstNode node: nodes) {
      arr.add(variant(node));
    }
    return arr;
  }

  public static JsonArray nodes(List<? extends AstNode> nodes) {
    JsonArray arr = new JsonArray();
    for (AstNode node: nodes) {
      arr.add(node.toJson());
    }
    return arr;
  }

  public static JsonArray ids(List<String> ids) {
    JsonArray arr = new JsonArray();
    for (String id: ids) {
      arr.add(id);
    }
    return arr;
  }

  public static String toJsonString(AstNode node, boolean pretty) {
    return (pretty ? prettyGson : gson).toJson(node.toJson());
  }

  public static String toJsonString(AstNode node) {
    return toJsonString(node, false);
  }
}
