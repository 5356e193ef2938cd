package com.manufacturing.semanticlayer.store;

import lombok.Value;

@Value
public class StoredEdge {
    String fromKey;
    String toKey;
    String type;
    String attributes;
}
