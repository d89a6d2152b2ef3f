package io.nosqlbench.cfgraph.api.store;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Normalization of raw attribute payloads into the value shapes promised by
/// [RawVariableStore].
public final class AttributeValues {

  private AttributeValues() {
  }

  /// Normalize an attribute payload.
  ///
  /// Arrays (primitive or not) and collections become immutable lists, one element arrays
  /// collapse to their element, `char[]` payloads become strings and everything else is
  /// returned as-is. A `byte[]` is numeric (`NC_BYTE`) and becomes a list of `Byte`.
  ///
  /// @param raw the attribute payload as produced by a storage layer
  /// @return the normalized value
  /// @throws IllegalArgumentException if an array or collection holds a null element
  public static Object normalize(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof char[] chars) {
      return trimText(new String(chars));
    }
    if (raw instanceof String s) {
      return s;
    }
    List<Object> elements;
    if (raw.getClass().isArray()) {
      int length = Array.getLength(raw);
      elements = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        elements.add(normalizeElement(Array.get(raw, i), i));
      }
    } else if (raw instanceof Collection<?> collection) {
      elements = new ArrayList<>(collection.size());
      for (Object element : collection) {
        elements.add(normalizeElement(element, elements.size()));
      }
    } else {
      return raw;
    }
    if (elements.size() == 1) {
      return elements.get(0);
    }
    return List.copyOf(elements);
  }

  private static Object normalizeElement(Object element, int index) {
    if (element == null) {
      throw new IllegalArgumentException("attribute value has a null element at index " + index);
    }
    return normalize(element);
  }

  /// Strip trailing blanks and NUL padding from fixed width text.
  ///
  /// @param text the padded text
  /// @return the text without trailing padding
  public static String trimText(String text) {
    int end = text.length();
    while (end > 0) {
      char c = text.charAt(end - 1);
      if (c == '\0' || Character.isWhitespace(c)) {
        end--;
      } else {
        break;
      }
    }
    return text.substring(0, end);
  }
}
