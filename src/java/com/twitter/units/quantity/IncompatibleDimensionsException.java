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

package com.twitter.units.quantity;

/**
 * Thrown when a conversion, sum, difference or comparison involves quantities whose dimensions
 * do not match.
 */
public class IncompatibleDimensionsException extends IllegalArgumentException {

  public IncompatibleDimensionsException(Unit from, Unit to) {
    this(String.format("'%s'", from.getName()), String.format("'%s'", to.getName()));
  }

  public IncompatibleDimensionsException(Unit from, String to) {
    this(String.format("'%s'", from.getName()), to);
  }

  private IncompatibleDimensionsException(String from, String to) {
    super(String.format("%s and %s have incompatible dimensions.", from, to));
  }
}
