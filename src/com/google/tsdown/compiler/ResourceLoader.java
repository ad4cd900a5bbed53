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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;

/** Utility class that handles resource loading. */
final class ResourceLoader {
  static String loadTextResource(Class<?> clazz, String path) {
    InputStream stream = clazz.getResourceAsStream(path);
    if (stream == null) {
      throw new RuntimeException("No such resource: " + path);
    }
    try (InputStreamReader reader = new InputStreamReader(stream, UTF_8)) {
      return CharStreams.toString(reader);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  static boolean resourceExists(Class<?> clazz, String path) {
    return clazz.getResource(path) != null;
  }

  private ResourceLoader() {}
}
