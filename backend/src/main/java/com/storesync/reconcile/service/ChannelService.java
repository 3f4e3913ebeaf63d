package com.storesync.reconcile.service;

import com.storesync.diff.comparator.ChannelComparator;
import com.storesync.domain.Channel;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ChannelService extends ReconciliationService<Channel> {

    public ChannelService(EntityRepository<Channel> repository, ReconciliationSupport support) {
        super(repository, new ChannelComparator(), support);
    }

    @Override
    public List<Channel> sectionOf(StoreConfig config) {
        return config.getChannels();
    }

    @Override
    protected void validate(Channel input) {
        require(input.getSlug(), "slug");
        require(input.getName(), "name");
        require(input.getCurrencyCode(), "currencyCode");
        require(input.getDefaultCountry(), "defaultCountry");
    }
}
