// This file is part of seriescache.
// Copyright (C) 2021-2022  The seriescache Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.seriescache.exceptions;

/**
 * Thrown by {@link net.seriescache.provider.SeriesFetcher} implementations
 * when a provider call failed. Propagated as-is through the caches.
 *
 * @since 1.0
 */
public class FetchException extends RuntimeException {
  private static final long serialVersionUID = -2466170834911047120L;

  /** A status code associated with the exception. The code value depends on
   * the remote source, e.g. an HTTP status. */
  protected final int status_code;

  /**
   * Ctor setting a message and status code.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public FetchException(final String msg, final int status_code) {
    super(msg);
    this.status_code = status_code;
  }

  /**
   * Ctor setting a message, status code and the original exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public FetchException(final String msg,
                        final int status_code,
                        final Exception e) {
    super(msg, e);
    this.status_code = status_code;
  }

  /** @return The status code, 0 if not set. */
  public int getStatusCode() {
    return status_code;
  }
}
