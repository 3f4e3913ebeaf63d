package com.storesync.reconcile.service;

import com.storesync.diff.comparator.AttributeComparator;
import com.storesync.domain.Attribute;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AttributeService extends ReconciliationService<Attribute> {

    public AttributeService(EntityRepository<Attribute> repository, ReconciliationSupport support) {
        super(repository, new AttributeComparator(), support);
    }

    @Override
    public List<Attribute> sectionOf(StoreConfig config) {
        return config.getAttributes();
    }

    @Override
    protected void validate(Attribute input) {
        require(input.getName(), "name");
        require(input.getInputType(), "inputType");
    }
}
