package com.kpiforecast.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;

/** Read-only view of the daily KPI mart, one row per calendar day. */
@Entity
@Immutable
@Table(name = "mart_daily_kpis")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyKpi {

    @Id
    @Column(name = "full_date", nullable = false)
    private LocalDate fullDate;

    @Column(name = "total_revenue")
    private Double totalRevenue;

    @Column(name = "total_orders")
    private Double totalOrders;

    @Column(name = "unique_customers")
    private Double uniqueCustomers;

    @Column(name = "avg_order_value")
    private Double avgOrderValue;

    @Column(name = "total_items_sold")
    private Double totalItemsSold;
}
