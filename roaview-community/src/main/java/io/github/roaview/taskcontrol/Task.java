/*
 * Copyright (c) 2024-2025 The roaview Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.roaview.taskcontrol;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A unit of work that runs on a worker thread so that an interactive front end stays responsive.
 */
public interface Task extends Runnable {

  @NotNull String getTaskDescription();

  /**
   * @return progress between 0 and 1
   */
  double getFinishedPercentage();

  @NotNull TaskStatus getStatus();

  @Nullable String getErrorMessage();

  /**
   * Requests cancellation. Running tasks stop at the next check point.
   */
  void cancel();

  default boolean isCanceled() {
    return getStatus() == TaskStatus.CANCELED;
  }

  default boolean isFinished() {
    final TaskStatus status = getStatus();
    return status == TaskStatus.FINISHED || status == TaskStatus.CANCELED
        || status == TaskStatus.ERROR;
  }
}
