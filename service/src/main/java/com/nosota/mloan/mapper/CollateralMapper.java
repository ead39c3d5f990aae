package com.nosota.mloan.mapper;

import com.nosota.mloan.api.response.CollateralDepositResponse;
import com.nosota.mloan.api.response.CollateralSummaryResponse;
import com.nosota.mloan.api.response.LoanStatusResponse;
import com.nosota.mloan.model.CollateralDeposit;
import com.nosota.mloan.model.LoanCollateralSummary;
import com.nosota.mloan.model.LoanStatusRecord;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for collateral engine entities to API responses.
 */
@Mapper
public interface CollateralMapper {

    CollateralMapper INSTANCE = Mappers.getMapper(CollateralMapper.class);

    CollateralDepositResponse toResponse(CollateralDeposit deposit);

    List<CollateralDepositResponse> toResponseList(List<CollateralDeposit> deposits);

    CollateralSummaryResponse toResponse(LoanCollateralSummary summary);

    LoanStatusResponse toResponse(LoanStatusRecord statusRecord);
}
