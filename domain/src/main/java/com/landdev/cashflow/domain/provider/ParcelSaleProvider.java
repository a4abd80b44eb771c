package com.landdev.cashflow.domain.provider;

import com.landdev.cashflow.domain.model.ParcelSale;

import java.util.List;

/**
 * Read-only source of parcel sale assumptions
 */
public interface ParcelSaleProvider {

    List<ParcelSale> findParcelSales(Long projectId);
}
