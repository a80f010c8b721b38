/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.floodcontrol;

/**
 * Fatal failure of a report run: the input cannot be read, the header does
 * not match the dataset schema, or the outputs cannot be written.
 *
 * <p>Row-level problems never raise this exception; they are recorded in the
 * run log and the row is dropped.
 */
public class FloodControlException extends RuntimeException {

  /**
   * Creates a new FloodControlException with the specified message.
   */
  public FloodControlException(String message) {
    super(message);
  }

  /**
   * Creates a new FloodControlException with the specified message and cause.
   */
  public FloodControlException(String message, Throwable cause) {
    super(message, cause);
  }
}
