package io.jobwatch.joblog;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.io.Closeable;
import java.io.IOException;

/// Append-only destination for report rows.
///
/// Rows arrive in the order their END events appear in the input.
public interface ReportSink extends Closeable {

    /// Append one row.
    ///
    /// @param row the row to append
    /// @throws IOException if the row cannot be written
    void write(ReportRow row) throws IOException;
}
