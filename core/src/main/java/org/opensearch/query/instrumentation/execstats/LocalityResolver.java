/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.List;

/** Source of cluster node localities. */
public interface LocalityResolver {

  /** Returns the descriptors of every node known to this node. */
  List<NodeDescriptor> allKnownNodeDescriptors();
}
