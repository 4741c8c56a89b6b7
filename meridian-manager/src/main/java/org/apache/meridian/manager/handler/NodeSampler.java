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

package org.apache.meridian.manager.handler;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Picks the nodes a new app config is pushed to.
 */
public final class NodeSampler {

  private NodeSampler() {
  }

  /**
   * @return {@code ceil(nodes.size() * percentage / 100)} distinct nodes
   * chosen uniformly at random
   */
  public static <T> List<T> sample(List<T> nodes, int percentage,
      Random random) {
    Preconditions.checkArgument(percentage >= 0 && percentage <= 100,
        "percentage must be in [0, 100]: %s", percentage);
    int count = sampleSize(nodes.size(), percentage);
    List<T> shuffled = new ArrayList<>(nodes);
    Collections.shuffle(shuffled, random);
    return new ArrayList<>(shuffled.subList(0, count));
  }

  static int sampleSize(int nodeCount, int percentage) {
    return (int) Math.ceil(nodeCount * percentage / 100.0);
  }
}
