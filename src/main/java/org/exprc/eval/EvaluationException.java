/*
 * Copyright 2025 The Exprc Authors
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

package org.exprc.eval;

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;

/** Thrown when a compiled expression can't be evaluated with the values it was given. */
public class EvaluationException extends RuntimeException {

  @FormatMethod
  public EvaluationException(@FormatString String format, Object... args) {
    super(String.format(format, args));
  }

  public EvaluationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
