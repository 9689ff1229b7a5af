package com.regwatch.service.runtime;

import com.regwatch.core.model.Change;
import com.regwatch.core.model.SweepRecord;

import java.util.List;

public record SweepReport(SweepRecord record, List<Change> changes, boolean interrupted) {
}
