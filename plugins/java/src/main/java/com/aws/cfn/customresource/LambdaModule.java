package com.aws.cfn.customresource;

import com.aws.cfn.customresource.proxy.OkHttpResponseSender;
import com.aws.cfn.customresource.proxy.ResponseSender;
import com.aws.cfn.customresource.resource.Serializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

public class LambdaModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(ResponseSender.class).to(OkHttpResponseSender.class);
    }

    @Provides
    ObjectMapper provideObjectMapper() {
        return Serializer.configureObjectMapper(new ObjectMapper());
    }
}
