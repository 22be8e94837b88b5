// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timequery.query.interpolation;

/**
 * What an empty time bucket emits.
 * 
 * @since 3.0
 */
public enum FillPolicy {
  /** The reducer's own value for zero points, null for all but count. */
  NULL,
  
  /** Empty buckets are dropped. */
  NONE,
  
  /** The last non-null value emitted by a non-empty bucket. */
  PREVIOUS,
  
  /** A literal value cast to the output type. */
  NUMBER,
  
  /** Linear interpolation between the surrounding non-empty buckets. */
  LINEAR
}
