package com.nosota.mloan.mapper;

import com.nosota.mloan.api.response.LoanResponse;
import com.nosota.mloan.model.LoanRecord;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for LoanRecord entity to LoanResponse conversion.
 */
@Mapper
public interface LoanMapper {

    LoanMapper INSTANCE = Mappers.getMapper(LoanMapper.class);

    LoanResponse toResponse(LoanRecord loan);
}
