package com.edareport.analyzer.dto.profile;

import lombok.Value;

@Value
public class CategoryFrequency {
  String value;
  long count;
}
