// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.units.parse;

/**
 * Thrown when a unit string contains a term that does not resolve to any known prefix and unit
 * symbol combination.
 */
public class UnknownUnitException extends IllegalArgumentException {

  private final String term;

  public UnknownUnitException(String term) {
    super(String.format("'%s' is an unknown or unconfigured unit.", term));
    this.term = term;
  }

  public UnknownUnitException(String term, Throwable cause) {
    super(String.format("'%s' is an unknown or unconfigured unit.", term), cause);
    this.term = term;
  }

  /**
   * Returns the offending term.
   */
  public String getTerm() {
    return term;
  }
}
