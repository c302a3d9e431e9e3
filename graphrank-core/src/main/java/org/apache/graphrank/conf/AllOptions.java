/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.graphrank.conf;

import org.apache.graphrank.centrality.CentralitySettings;
import org.apache.log4j.Logger;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks all of the GraphRank options
 */
public class AllOptions {
  /**  logger object */
  private static final Logger LOG = Logger.getLogger(AllOptions.class);

  /** Don't construct */
  private AllOptions() { }

  /**
   * Collect the options declared as public static fields of the given
   * classes
   *
   * @param holders Classes declaring options
   * @return Options, sorted by type and key
   */
  public static List<AbstractConfOption> collect(Class<?>... holders) {
    List<AbstractConfOption> options = new ArrayList<>();
    for (Class<?> holder : holders) {
      for (Field field : holder.getFields()) {
        if (Modifier.isStatic(field.getModifiers()) &&
            AbstractConfOption.class.isAssignableFrom(field.getType())) {
          try {
            options.add((AbstractConfOption) field.get(null));
          } catch (IllegalAccessException e) {
            throw new IllegalStateException("collect: Couldn't read " +
                holder.getName() + "." + field.getName(), e);
          }
        }
      }
    }
    Collections.sort(options);
    return options;
  }

  /**
   * String representation of the options, grouped by type
   *
   * @param options Options, sorted by type
   * @return string
   */
  public static String allOptionsString(List<AbstractConfOption> options) {
    StringBuilder sb = new StringBuilder(options.size() * 60);
    sb.append("All Options:\n");
    ConfOptionType lastType = null;
    for (AbstractConfOption confOption : options) {
      if (!confOption.getType().equals(lastType)) {
        sb.append(confOption.getType().toString().toLowerCase()).append(":\n");
        lastType = confOption.getType();
      }
      sb.append("  ").append(confOption.getKey()).append(" => ")
          .append(confOption.getDefaultValueStr()).append(": ")
          .append(confOption.getDescription()).append('\n');
    }
    return sb.toString();
  }

  /**
   * Command line utility to dump all GraphRank options
   *
   * @param args cmdline args
   */
  public static void main(String[] args) {
    LOG.info(allOptionsString(
        collect(GraphRankConstants.class, CentralitySettings.class)));
  }
}
