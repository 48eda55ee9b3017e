/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.hashid.hasher;

import com.axonops.hashid.api.Hasher;
import com.axonops.hashid.api.HasherType;
import com.axonops.hashid.codec.Codec;

/**
 * Plain codec strategy using the factory defaults.
 *
 * @since 1.0.0
 */
public final class DefaultHasher extends HashidsConverter implements Hasher {

  public DefaultHasher(Codec codec) {
    super(codec);
  }

  @Override
  public HasherType type() {
    return HasherType.DEFAULT;
  }
}
