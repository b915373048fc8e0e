// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hbaserpc.client;

import com.google.common.annotations.VisibleForTesting;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Representation of an error code and message, attached to every {@link HBaseRpcException}.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class Status {

  // Server-side stack traces can be huge, keep the message bounded.
  @VisibleForTesting
  static final int MAX_MESSAGE_LENGTH = 32 * 1024;
  @VisibleForTesting
  static final String ABBREVIATION_CHARS = "...";
  @VisibleForTesting
  static final int ABBREVIATION_CHARS_LENGTH = ABBREVIATION_CHARS.length();

  /** The kind of error a status represents. */
  enum Code {
    NOT_FOUND("Not found"),
    CORRUPTION("Corruption"),
    INVALID_ARGUMENT("Invalid argument"),
    ILLEGAL_STATE("Illegal state"),
    NETWORK_ERROR("Network error"),
    REMOTE_ERROR("Remote error"),
    SERVICE_UNAVAILABLE("Service unavailable"),
    TIMED_OUT("Timed out"),
    ABORTED("Aborted"),
    INCOMPLETE("Incomplete");

    private final String displayName;

    Code(String displayName) {
      this.displayName = displayName;
    }
  }

  private final Code code;
  private final String message;

  private Status(Code code, String msg) {
    this.code = code;
    if (msg.length() > MAX_MESSAGE_LENGTH) {
      // Truncate the message and indicate that it was abbreviated.
      this.message = msg.substring(0, MAX_MESSAGE_LENGTH - ABBREVIATION_CHARS_LENGTH) +
          ABBREVIATION_CHARS;
    } else {
      this.message = msg;
    }
  }

  // CHECKSTYLE:OFF
  public static Status NotFound(String msg) {
    return new Status(Code.NOT_FOUND, msg);
  }

  public static Status Corruption(String msg) {
    return new Status(Code.CORRUPTION, msg);
  }

  public static Status InvalidArgument(String msg) {
    return new Status(Code.INVALID_ARGUMENT, msg);
  }

  public static Status IllegalState(String msg) {
    return new Status(Code.ILLEGAL_STATE, msg);
  }

  public static Status NetworkError(String msg) {
    return new Status(Code.NETWORK_ERROR, msg);
  }

  public static Status RemoteError(String msg) {
    return new Status(Code.REMOTE_ERROR, msg);
  }

  public static Status ServiceUnavailable(String msg) {
    return new Status(Code.SERVICE_UNAVAILABLE, msg);
  }

  public static Status TimedOut(String msg) {
    return new Status(Code.TIMED_OUT, msg);
  }

  public static Status Aborted(String msg) {
    return new Status(Code.ABORTED, msg);
  }

  public static Status Incomplete(String msg) {
    return new Status(Code.INCOMPLETE, msg);
  }
  // CHECKSTYLE:ON

  public boolean isNotFound() {
    return code == Code.NOT_FOUND;
  }

  public boolean isCorruption() {
    return code == Code.CORRUPTION;
  }

  public boolean isInvalidArgument() {
    return code == Code.INVALID_ARGUMENT;
  }

  public boolean isIllegalState() {
    return code == Code.ILLEGAL_STATE;
  }

  public boolean isNetworkError() {
    return code == Code.NETWORK_ERROR;
  }

  public boolean isRemoteError() {
    return code == Code.REMOTE_ERROR;
  }

  public boolean isServiceUnavailable() {
    return code == Code.SERVICE_UNAVAILABLE;
  }

  public boolean isTimedOut() {
    return code == Code.TIMED_OUT;
  }

  public boolean isAborted() {
    return code == Code.ABORTED;
  }

  public boolean isIncomplete() {
    return code == Code.INCOMPLETE;
  }

  /**
   * Get enum code name.
   * Intended for internal use only.
   */
  String getCodeName() {
    return code.name();
  }

  /**
   * Returns string error message.
   * Intended for internal use only.
   */
  String getMessage() {
    return message;
  }

  /**
   * Get a human-readable version of the Status message fit for logging or display.
   */
  @Override
  public String toString() {
    return String.format("%s: %s", code.displayName, message);
  }
}
