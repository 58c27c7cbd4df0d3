package com.clustermgmt.querytelemetry.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

/**
 * Model for the query_groups table, owned by the grouping feature of the dashboard.
 * Only read here to check that a referenced group exists.
 */
@Table("query_groups")
@IdName("id_query_group")
public class QueryGroup extends Model {

    public static boolean exists(long groupId) {
        return QueryGroup.count("id_query_group = ?", groupId) > 0;
    }
}
