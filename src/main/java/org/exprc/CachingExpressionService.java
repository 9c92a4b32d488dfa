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

package org.exprc;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.exprc.compiler.CompileError;
import org.exprc.functions.FunctionLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ExpressionService that remembers the most recently compiled expressions, keyed by their text.
 * Expressions that fail to compile are not remembered.
 */
public class CachingExpressionService implements ExpressionService {
  private static final Logger logger = LoggerFactory.getLogger(CachingExpressionService.class);

  private final ExpressionService delegate;
  private final LoadingCache<String, CompiledExpression> cache;

  public CachingExpressionService(ExpressionService delegate, long maximumSize) {
    Preconditions.checkArgument(maximumSize > 0, "maximumSize must be positive");
    this.delegate = Preconditions.checkNotNull(delegate);
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build(
                new CacheLoader<String, CompiledExpression>() {
                  @Override
                  public CompiledExpression load(String expression) {
                    logger.debug("Cache miss: {}", expression);
                    return delegate.compile(expression);
                  }
                });
  }

  @Override
  public CompiledExpression compile(String expression) {
    try {
      return cache.getUnchecked(expression);
    } catch (UncheckedExecutionException e) {
      if (e.getCause() instanceof CompileError compileError) {
        throw compileError;
      }
      throw e;
    }
  }

  @Override
  public MathDefinition definition() {
    return delegate.definition();
  }

  @Override
  public FunctionLibrary functions() {
    return delegate.functions();
  }

  /** The number of compilations performed by the delegate, including failed ones. */
  @VisibleForTesting
  long loadCount() {
    return cache.stats().loadCount();
  }

  @VisibleForTesting
  long size() {
    cache.cleanUp();
    return cache.size();
  }
}
