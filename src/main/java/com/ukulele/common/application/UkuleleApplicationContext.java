package com.ukulele.common.application;

import com.ukulele.core.net.node.SyncManager;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

public class UkuleleApplicationContext extends AnnotationConfigApplicationContext {

  public UkuleleApplicationContext() {
  }

  public UkuleleApplicationContext(DefaultListableBeanFactory beanFactory) {
    super(beanFactory);
  }

  public UkuleleApplicationContext(Class<?>... annotatedClasses) {
    super(annotatedClasses);
  }

  public UkuleleApplicationContext(String... basePackages) {
    super(basePackages);
  }

  @Override
  public void destroy() {
    SyncManager syncManager = getBean(SyncManager.class);
    syncManager.stop();
    super.destroy();
  }
}
