/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.tsdown.compiler;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;

/**
 * The tslib-compatible runtime functions that lowered code calls. Each helper's text lives in a
 * resource under {@code js/}; a file that needs a helper gets one copy of its text at the top of
 * the output. Helpers are emitted in declaration order.
 */
public enum RuntimeHelper {
  EXTENDS("__extends", "extends.js"),
  ASSIGN("__assign", "assign.js"),
  REST("__rest", "rest.js"),
  DECORATE("__decorate", "decorate.js"),
  MAKE_TEMPLATE_OBJECT("__makeTemplateObject", "make_template_object.js"),
  AWAITER("__awaiter", "awaiter.js"),
  GENERATOR("__generator", "generator.js"),
  VALUES("__values", "values.js"),
  SPREAD_ARRAY("__spreadArray", "spread_array.js"),
  CREATE_BINDING("__createBinding", "create_binding.js"),
  EXPORT_STAR("__exportStar", "export_star.js", CREATE_BINDING);

  private final String name;
  private final ImmutableSet<RuntimeHelper> dependencies;
  private final Supplier<String> text;

  RuntimeHelper(String name, String resource, RuntimeHelper... dependencies) {
    this.name = name;
    this.dependencies = ImmutableSet.copyOf(dependencies);
    this.text =
        Suppliers.memoize(
            () -> ResourceLoader.loadTextResource(RuntimeHelper.class, "js/" + resource));
  }

  /** The global name lowered code calls, e.g. {@code __awaiter}. */
  public String getName() {
    return name;
  }

  /** Helpers whose declarations this helper's text refers to. */
  public ImmutableSet<RuntimeHelper> getDependencies() {
    return dependencies;
  }

  /** The helper's declaration, ending in a newline. */
  public String getText() {
    return text.get();
  }
}
