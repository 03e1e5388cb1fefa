package com.bulut.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AliasSearchResponse {
    private String query;
    private int count;
    private List<AliasResponse> results;
}
