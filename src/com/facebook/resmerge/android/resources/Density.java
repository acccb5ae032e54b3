/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.android.resources;

import java.util.Optional;

/**
 * The density qualifiers that may appear on a resource directory, as defined in
 * http://developer.android.com/guide/topics/resources/providing-resources.html#DensityQualifier
 */
public enum Density {
  LDPI("ldpi"),
  MDPI("mdpi"),
  TVDPI("tvdpi"),
  HDPI("hdpi"),
  XHDPI("xhdpi"),
  XXHDPI("xxhdpi"),
  XXXHDPI("xxxhdpi"),
  NODPI("nodpi"),
  ANYDPI("anydpi");

  private final String qualifier;

  Density(String qualifier) {
    this.qualifier = qualifier;
  }

  public String getQualifier() {
    return qualifier;
  }

  @Override
  public String toString() {
    return qualifier;
  }

  public static Optional<Density> fromQualifier(String qualifier) {
    for (Density choice : values()) {
      if (choice.qualifier.equals(qualifier)) {
        return Optional.of(choice);
      }
    }
    return Optional.empty();
  }

  public static boolean isDensity(String qualifier) {
    return fromQualifier(qualifier).isPresent();
  }
}
