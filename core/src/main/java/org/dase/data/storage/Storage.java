/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.dase.data.storage;

import java.io.File;
import java.util.Map;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;

/**
 * Locates the event store. The location is, in order of precedence, the
 * {@value #EVENTDATA_PATH_CONF} Spark configuration, the {@value #EVENTDATA_PATH_ENV}
 * environment variable, or the "data/events" directory of DASE_HOME.
 */
public final class Storage {

  public static final String EVENTDATA_PATH_CONF = "spark.dase.storage.eventdata.path";
  public static final String EVENTDATA_PATH_ENV = "DASE_STORAGE_EVENTDATA_PATH";

  public static EventStore eventStore(JavaSparkContext sc) {
    return eventStore(sc.getConf(), System.getenv());
  }

  static EventStore eventStore(SparkConf conf, Map<String, String> env) {
    return new LocalFileEventStore(new File(eventDataPath(conf, env)));
  }

  static String eventDataPath(SparkConf conf, Map<String, String> env) {
    if (conf.contains(EVENTDATA_PATH_CONF)) {
      return conf.get(EVENTDATA_PATH_CONF);
    }
    String path = env.get(EVENTDATA_PATH_ENV);
    if (path != null && !path.isEmpty()) {
      return path;
    }
    String home = env.get("DASE_HOME");
    if (home == null || home.isEmpty()) {
      throw new IllegalStateException(String.format(
        "Cannot locate the event store; set %s, %s or DASE_HOME.", EVENTDATA_PATH_CONF,
        EVENTDATA_PATH_ENV));
    }
    return new File(new File(home, "data"), "events").getAbsolutePath();
  }

  private Storage() { }

}
