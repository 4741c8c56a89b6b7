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

package org.apache.meridian.manager;

import java.io.IOException;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.slf4j.Logger;

/**
 * Turns a failure of a manager operation into the exception it reports.
 * Domain errors pass through; anything else from the store becomes
 * STORE_UNAVAILABLE.
 */
final class StoreFailures {

  private StoreFailures() {
  }

  static MeridianException translate(Logger log, MeridianMetrics metrics,
      IOException ex, String operation, String entityId) {
    if (ex instanceof MeridianException) {
      MeridianException me = (MeridianException) ex;
      if (me.getResult() == ResultCodes.STORE_UNAVAILABLE) {
        metrics.incNumStoreFailures();
        log.warn("{} failed for entity:{}", operation, entityId, ex);
      } else if (!me.getResult().isClientError()) {
        log.debug("{} aborted for entity:{}: {}", operation, entityId,
            me.getMessage());
      }
      return me;
    }
    metrics.incNumStoreFailures();
    log.error("{} failed for entity:{}", operation, entityId, ex);
    return new MeridianException(operation + " failed for entity:"
        + entityId, ex, ResultCodes.STORE_UNAVAILABLE);
  }
}
