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

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes events as single-line JSON objects, for example:
 * <pre>
 * {"event":"$set","entityType":"user","entityId":"u1","properties":{"plan":1,"attr0":0},
 *  "eventTime":"2014-09-09T16:17:42.937-08:00"}
 * </pre>
 */
public final class EventJson {

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

  /**
   * @throws IllegalArgumentException If the line is not a valid event.
   */
  public static Event parse(String line) {
    Event event;
    try {
      event = MAPPER.readValue(line, Event.class);
    } catch (JsonProcessingException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IllegalArgumentException) {
        throw new IllegalArgumentException("Invalid event: " + cause.getMessage(), e);
      }
      throw new IllegalArgumentException("Invalid event JSON: " + e.getOriginalMessage(), e);
    }
    if (event == null) {
      throw new IllegalArgumentException("Invalid event: " + line);
    }
    return event;
  }

  public static String toJson(Event event) {
    try {
      return MAPPER.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize " + event, e);
    }
  }

  /** Parses an ISO-8601 time with an offset, such as "2014-09-09T16:17:42.937-08:00". */
  static Instant parseTime(String text) {
    try {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(text, Instant::from);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid eventTime '" + text + "'.", e);
    }
  }

  private EventJson() { }

}
