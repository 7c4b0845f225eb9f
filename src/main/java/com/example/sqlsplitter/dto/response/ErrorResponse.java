package com.example.sqlsplitter.dto.response;

import lombok.EqualsAndHashCode;
import lombok.experimental.SuperBuilder;

@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class ErrorResponse extends APIResponseDto {
}
