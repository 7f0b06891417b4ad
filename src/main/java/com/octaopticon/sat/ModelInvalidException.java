// Copyright 2026 The OctaOpticon Authors
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.octaopticon.sat;

/**
 * Thrown when the solver rejects the constraint model itself.
 *
 * <p>This is a defect in the code that built the model, never a property of the problem, so it is
 * not reported as infeasible or unknown.
 */
public class ModelInvalidException extends RuntimeException {
  public ModelInvalidException(String methodName, String msg) {
    super(methodName + ": " + msg);
  }
}
