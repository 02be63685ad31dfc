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

package io.github.roaview.modules.dataprocessing.baselinecorrection;

import io.github.roaview.datamodel.Modality;
import io.github.roaview.datamodel.SpectrumEntry;
import io.github.roaview.taskcontrol.AbstractTask;
import io.github.roaview.taskcontrol.TaskStatus;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Runs {@link BaselineManager#create} for a batch of spectra on a worker thread. The batch is
 * processed entry by entry so that the task can be canceled between two spectra. Entries that were
 * finished before a cancel keep their cache records.
 */
public class BaselineCorrectionTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(BaselineCorrectionTask.class.getName());

  private final BaselineManager manager;
  private final List<SpectrumEntry> entries;
  private final Map<Modality, Boolean> modalities;
  private final BaselineParameters parameters;
  private final CompletableFuture<List<SpectrumEntry>> result = new CompletableFuture<>();
  private volatile int processed;

  public BaselineCorrectionTask(@NotNull BaselineManager manager,
      @NotNull List<SpectrumEntry> entries, @NotNull Map<Modality, Boolean> modalities,
      @NotNull BaselineParameters parameters) {
    this.manager = manager;
    this.entries = List.copyOf(entries);
    this.modalities = modalities.isEmpty() ? new EnumMap<>(Modality.class)
        : new EnumMap<>(modalities);
    this.parameters = parameters;
  }

  /**
   * Submits this task and returns the future of the corrected entries. The future completes
   * exceptionally with a {@link CancellationException} if the task was canceled.
   */
  public @NotNull CompletableFuture<List<SpectrumEntry>> submit(@NotNull Executor executor) {
    executor.execute(this);
    return result;
  }

  public @NotNull CompletableFuture<List<SpectrumEntry>> getResult() {
    return result;
  }

  @Override
  public @NotNull String getTaskDescription() {
    return "Creating baselines for " + entries.size() + " spectra";
  }

  @Override
  public double getFinishedPercentage() {
    return entries.isEmpty() ? 0d : processed / (double) entries.size();
  }

  @Override
  public void run() {
    if (isCanceled()) {
      result.completeExceptionally(new CancellationException(getTaskDescription()));
      return;
    }
    setStatus(TaskStatus.PROCESSING);
    final List<SpectrumEntry> corrected = new ArrayList<>(entries.size());
    try {
      for (SpectrumEntry entry : entries) {
        if (isCanceled()) {
          logger.info(() -> "Baseline creation canceled after " + processed + " of "
              + entries.size() + " spectra");
          result.completeExceptionally(new CancellationException(getTaskDescription()));
          return;
        }
        corrected.add(manager.create(entry, modalities, parameters));
        processed++;
      }
    } catch (RuntimeException e) {
      error("Cannot create baseline: " + e.getMessage(), e);
      result.completeExceptionally(e);
      return;
    }

    setStatus(TaskStatus.FINISHED);
    // a cancel between the last entry and the status change wins
    if (isCanceled()) {
      result.completeExceptionally(new CancellationException(getTaskDescription()));
      return;
    }
    logger.info(() -> "Created baselines for " + corrected.size() + " spectra");
    result.complete(List.copyOf(corrected));
  }
}
