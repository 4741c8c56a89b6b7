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

package org.apache.meridian.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;

/**
 * Caller supplied time bound for one operation, which the caller may also
 * cancel from another thread.
 */
public final class Deadline {

  private final Ticker ticker;
  /** Absolute ticker reading, or Long.MAX_VALUE when unbounded. */
  private final long expiresAtNanos;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private Deadline(Ticker ticker, long expiresAtNanos) {
    this.ticker = ticker;
    this.expiresAtNanos = expiresAtNanos;
  }

  /**
   * @return a deadline that never expires but can still be cancelled.
   */
  public static Deadline none() {
    return new Deadline(Ticker.systemTicker(), Long.MAX_VALUE);
  }

  public static Deadline after(long duration, TimeUnit unit) {
    return after(duration, unit, Ticker.systemTicker());
  }

  public static Deadline after(long duration, TimeUnit unit, Ticker ticker) {
    Preconditions.checkArgument(duration >= 0,
        "duration must not be negative: %s", duration);
    long expiresAt =
        LongMath.saturatedAdd(ticker.read(), unit.toNanos(duration));
    return new Deadline(ticker, Math.min(expiresAt, Long.MAX_VALUE - 1));
  }

  public boolean isBounded() {
    return expiresAtNanos != Long.MAX_VALUE;
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public boolean isExpired() {
    return isBounded() && ticker.read() >= expiresAtNanos;
  }

  /**
   * @return time left in {@code unit}, never negative, or Long.MAX_VALUE
   * for an unbounded deadline.
   */
  public long remaining(TimeUnit unit) {
    if (!isBounded()) {
      return Long.MAX_VALUE;
    }
    long left = LongMath.saturatedSubtract(expiresAtNanos, ticker.read());
    return left <= 0 ? 0 : unit.convert(left, TimeUnit.NANOSECONDS);
  }

  /**
   * Fails if the operation should stop now.
   *
   * @param operation what was about to run, for the message
   * @throws MeridianException CANCELLED or DEADLINE_EXCEEDED
   */
  public void check(String operation) throws MeridianException {
    if (isCancelled()) {
      throw new MeridianException(operation + " cancelled by caller",
          ResultCodes.CANCELLED);
    }
    if (isExpired()) {
      throw new MeridianException("deadline exceeded before " + operation,
          ResultCodes.DEADLINE_EXCEEDED);
    }
  }

  @Override
  public String toString() {
    if (isCancelled()) {
      return "Deadline[cancelled]";
    }
    return isBounded()
        ? "Deadline[" + remaining(TimeUnit.MILLISECONDS) + "ms left]"
        : "Deadline[none]";
  }
}
