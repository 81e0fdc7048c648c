package com.tcgptracker.api.dto;

import lombok.Value;

import java.util.List;

/**
 * Cards newly collected by a bulk request.
 */
@Value
public class CollectRaritiesResponse {
    String setNumber;
    List<Long> collectedCardIds;
}
