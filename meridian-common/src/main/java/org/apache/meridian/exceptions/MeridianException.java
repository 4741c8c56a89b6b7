/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.meridian.exceptions;

import java.io.IOException;

/**
 * Exception thrown by the Meridian managers.
 */
public class MeridianException extends IOException {

  private final MeridianException.ResultCodes result;

  /**
   * Constructs an {@code IOException} with the specified detail message.
   *
   * @param message The detail message (which is saved for later retrieval by
   * the {@link #getMessage()} method)
   */
  public MeridianException(String message,
      MeridianException.ResultCodes result) {
    super(message);
    this.result = result;
  }

  /**
   * Constructs an {@code IOException} with the specified detail message
   * and cause.
   * <p>
   * Note that the detail message associated with {@code cause} is
   * <i>not</i> automatically incorporated into this exception's detail
   * message.
   *
   * @param message The detail message (which is saved for later retrieval by
   * the {@link #getMessage()} method)
   * @param cause The cause (which is saved for later retrieval by the {@link
   * #getCause()} method).  (A null value is permitted, and indicates that the
   * cause is nonexistent or unknown.)
   */
  public MeridianException(String message, Throwable cause,
      MeridianException.ResultCodes result) {
    super(message, cause);
    this.result = result;
  }

  /**
   * Returns resultCode.
   * @return ResultCode
   */
  public MeridianException.ResultCodes getResult() {
    return result;
  }

  @Override
  public String toString() {
    return result + " " + super.toString();
  }

  /**
   * Error codes to make it easy to decode these exceptions.
   * <p>
   * Client errors are fixed by changing the request. Retryable errors come
   * from the backing store or from running out of time, and the same request
   * may succeed later.
   */
  public enum ResultCodes {

    ENTITY_NOT_FOUND(true, false),

    ENTITY_ALREADY_EXISTS(true, false),

    UNSUPPORTED_RESOURCE_KIND(true, false),

    INVALID_QUOTA(true, false),

    EXCEEDS_PARENT_CAPACITY(true, false),

    BELOW_CHILD_UTILIZATION(true, false),

    NON_EMPTY_SUBTREE(true, false),

    INVALID_REQUEST(true, false),

    STORE_UNAVAILABLE(false, true),

    TIMEOUT(false, true),

    DEADLINE_EXCEEDED(false, true),

    CANCELLED(false, false),

    SECCOMP_PROFILE_FAILED(false, true),

    DISSEMINATION_FAILED(false, true),

    INTERNAL_ERROR(false, false);

    private final boolean clientError;
    private final boolean retryable;

    ResultCodes(boolean clientError, boolean retryable) {
      this.clientError = clientError;
      this.retryable = retryable;
    }

    public boolean isClientError() {
      return clientError;
    }

    public boolean isRetryable() {
      return retryable;
    }
  }
}
